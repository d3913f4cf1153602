package com.modelgate.providers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.modelgate.providers.AuthType.API_KEY;
import static com.modelgate.providers.AuthType.BEARER;
import static com.modelgate.providers.AuthType.NONE;
import static com.modelgate.providers.ProtocolType.ANTHROPIC;
import static com.modelgate.providers.ProtocolType.OPENAI_COMPATIBLE;

public final class BuiltinProviders {

    /** Providers that need no credential, only the local-enabled marker. */
    public static final Set<String> LOCAL_PROVIDERS = Set.of("ollama", "lmstudio");

    private static final Map<String, ProviderDefinition> DEFINITIONS = table(List.of(
        ProviderDefinition.of("openai", "OpenAI", "https://api.openai.com/v1", OPENAI_COMPATIBLE, BEARER)
            .withOAuth(),
        ProviderDefinition.of("anthropic", "Anthropic", "https://api.anthropic.com/v1", ANTHROPIC, API_KEY)
            .withOAuth(),
        ProviderDefinition.of("github_copilot", "GitHub Copilot", "https://api.githubcopilot.com",
                OPENAI_COMPATIBLE, BEARER)
            .withOAuth(),
        ProviderDefinition.of("moonshot", "Moonshot", "https://api.moonshot.cn/v1", OPENAI_COMPATIBLE, BEARER)
            .withInternational("https://api.kimi.com/v1"),
        ProviderDefinition.of("kimi_coding", "Kimi Coding Plan", "https://api.kimi.com/coding/v1",
                OPENAI_COMPATIBLE, BEARER),
        ProviderDefinition.of("MiniMax", "MiniMax", "https://api.minimaxi.com/v1", OPENAI_COMPATIBLE, BEARER)
            .withAltBilling("https://api.minimaxi.com/anthropic/v1")
            .withInternational("https://api.minimaxi.chat/anthropic/v1"),
        ProviderDefinition.of("zhipu", "Zhipu AI", "https://open.bigmodel.cn/api/paas/v4/",
                OPENAI_COMPATIBLE, BEARER)
            .withAltBilling("https://open.bigmodel.cn/api/coding/paas/v4"),
        ProviderDefinition.of("zai", "Z.AI", "https://api.z.ai/api/paas/v4/", OPENAI_COMPATIBLE, BEARER)
            .withAltBilling("https://api.z.ai/api/coding/paas/v4"),
        ProviderDefinition.of("openRouter", "OpenRouter", "https://openrouter.ai/api/v1", OPENAI_COMPATIBLE, BEARER),
        ProviderDefinition.of("deepseek", "Deepseek", "https://api.deepseek.com", OPENAI_COMPATIBLE, BEARER),
        ProviderDefinition.of("google", "Google AI", "https://generativelanguage.googleapis.com/v1beta",
                OPENAI_COMPATIBLE, BEARER),
        ProviderDefinition.of("groq", "Groq", "https://api.groq.com/openai/v1", OPENAI_COMPATIBLE, BEARER),
        ProviderDefinition.of("ollama", "Ollama", "http://127.0.0.1:11434", OPENAI_COMPATIBLE, NONE),
        ProviderDefinition.of("lmstudio", "LM Studio", "http://127.0.0.1:1234", OPENAI_COMPATIBLE, NONE)
    ));

    private BuiltinProviders() {}

    /** Built-in definitions in declaration order. */
    public static Map<String, ProviderDefinition> definitions() {
        return DEFINITIONS;
    }

    public static boolean isBuiltin(String providerId) {
        return DEFINITIONS.containsKey(providerId);
    }

    public static List<String> withAltBilling() {
        return DEFINITIONS.values().stream()
                .filter(ProviderDefinition::supportsAltBilling)
                .map(ProviderDefinition::id)
                .toList();
    }

    public static List<String> withInternational() {
        return DEFINITIONS.values().stream()
                .filter(ProviderDefinition::supportsInternational)
                .map(ProviderDefinition::id)
                .toList();
    }

    private static Map<String, ProviderDefinition> table(List<ProviderDefinition> definitions) {
        var map = new LinkedHashMap<String, ProviderDefinition>();
        for (var def : definitions) {
            if (map.put(def.id(), def) != null) {
                throw new IllegalStateException("Duplicate built-in provider id: " + def.id());
            }
        }
        return java.util.Collections.unmodifiableMap(map);
    }
}
