package com.modelgate.shared.config;

import java.nio.file.Path;
import java.util.Map;

public record GatewayConfig(
    Path dataDir,
    StreamConfig stream,
    Map<String, String> oauthRefreshCommands
) {
    public static final Map<String, String> DEFAULT_OAUTH_REFRESH_COMMANDS = Map.of(
        "anthropic", "llm_claude_oauth_refresh",
        "openai", "llm_openai_oauth_refresh",
        "github_copilot", "llm_github_copilot_oauth_refresh"
    );

    public Path settingsFile() {
        return dataDir.resolve("settings.yaml");
    }

    public Path customProvidersFile() {
        return dataDir.resolve("custom-providers.json");
    }

    public Path customModelsFile() {
        return dataDir.resolve("custom-models.json");
    }
}
