package com.modelgate.settings;

import com.modelgate.auth.OAuthBundle;
import com.modelgate.auth.OAuthTokenStore;
import com.modelgate.models.ModelDescriptor;
import com.modelgate.providers.CustomProviderConfig;
import com.modelgate.providers.ProtocolType;
import com.modelgate.providers.ProviderRegistryBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CredentialLoaderTest {

    @TempDir
    Path tempDir;

    private YamlSettingsStore settings;
    private CustomProviderService providers;
    private CustomModelService models;

    @BeforeEach
    void setUp() {
        settings = new YamlSettingsStore(tempDir.resolve("settings.yaml"));
        providers = new CustomProviderService(tempDir.resolve("custom-providers.json"));
        models = new CustomModelService(tempDir.resolve("custom-models.json"));
    }

    @Test
    void readsEverySource() {
        settings.set(SettingsKeys.apiKey("deepseek"), "sk-ds");
        settings.set(SettingsKeys.apiKey("ollama"), "enabled");
        settings.set(SettingsKeys.baseUrl("openai"), "https://proxy.example");
        settings.set(SettingsKeys.altBilling("zhipu"), "true");
        settings.set(SettingsKeys.altBilling("zai"), "false");
        settings.set(SettingsKeys.international("moonshot"), "true");
        providers.add(new CustomProviderConfig("acme", "Acme", ProtocolType.OPENAI_COMPATIBLE,
                "https://acme.example", "sk-acme", true, null, null, null));
        settings.set(SettingsKeys.apiKey("acme"), "sk-override");
        models.add("acme-1", ModelDescriptor.of("Acme 1", List.of("acme")));

        var oauth = mock(OAuthTokenStore.class);
        var bundle = new OAuthBundle("tok", "ref", Instant.parse("2030-01-01T00:00:00Z"), "acct");
        when(oauth.currentToken()).thenReturn(bundle);

        var loaded = new CredentialLoader(settings, providers, models, Map.of("openai", oauth)).load();
        var creds = loaded.credentials();

        assertEquals("sk-ds", creds.secret("deepseek"));
        assertEquals("enabled", creds.secret("ollama"));
        assertEquals("sk-override", creds.secret("acme"));
        assertEquals("https://proxy.example", creds.baseUrlOverrides().get("openai"));
        assertTrue(creds.altBilling("zhipu"));
        assertFalse(creds.altBilling("zai"));
        assertTrue(creds.international("moonshot"));
        assertEquals(bundle, creds.oauth().get("openai"));
        assertEquals(List.of("acme"), loaded.customProviders().stream().map(CustomProviderConfig::id).toList());
        assertTrue(loaded.customModels().containsKey("acme-1"));
        assertFalse(loaded.degraded());
    }

    @Test
    void failingSourcesDegradeIndependently() throws IOException {
        settings.set(SettingsKeys.apiKey("deepseek"), "sk-ds");
        Files.writeString(tempDir.resolve("custom-models.json"), "[broken");
        var oauth = mock(OAuthTokenStore.class);
        when(oauth.currentToken()).thenThrow(new IllegalStateException("keychain locked"));

        var loaded = new CredentialLoader(settings, providers, models, Map.of("anthropic", oauth)).load();

        assertEquals("sk-ds", loaded.credentials().secret("deepseek"));
        assertTrue(loaded.customModels().isEmpty());
        assertTrue(loaded.credentials().oauth().isEmpty());
        assertEquals(2, loaded.failures().size());
        assertTrue(loaded.failures().stream().anyMatch(f -> f.contains("keychain locked")));
    }

    @Test
    void disconnectedOAuthIsOmitted() {
        var oauth = mock(OAuthTokenStore.class);
        when(oauth.currentToken()).thenReturn(null);

        var loaded = new CredentialLoader(settings, providers, models, Map.of("openai", oauth)).load();
        assertFalse(loaded.credentials().oauth().containsKey("openai"));
    }

    @Test
    void unknownProviderTypeSkipsOnlyThatEntry() throws IOException {
        Files.writeString(tempDir.resolve("custom-providers.json"), """
            {"version": 1, "providers": {
              "good": {"name": "Good", "type": "openai-compatible", "baseUrl": "https://good.example",
                       "apiKey": "k", "enabled": true},
              "bad": {"name": "Bad", "type": "gemini", "baseUrl": "https://bad.example",
                      "apiKey": "k", "enabled": true}}}
            """);

        var loaded = new CredentialLoader(settings, providers, models, Map.of()).load();
        var registry = ProviderRegistryBuilder.build(loaded.customProviders());

        assertFalse(loaded.degraded());
        assertEquals(List.of("good"), loaded.customProviders().stream().map(CustomProviderConfig::id).toList());
        assertTrue(registry.contains("good"));
        assertFalse(registry.contains("bad"));
    }
}
