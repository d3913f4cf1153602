package com.modelgate.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".modelgate");
    private static final Path DEFAULT_PATH = DEFAULT_DATA_DIR.resolve("config.yaml");

    public static GatewayConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static GatewayConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var stream = (Map<String, Object>) raw.getOrDefault("stream", Map.of());
        var oauth = (Map<String, Object>) raw.getOrDefault("oauth", Map.of());

        var dataDir = envOrDefault("MODELGATE_DATA_DIR",
            String.valueOf(raw.getOrDefault("data-dir", DEFAULT_DATA_DIR.toString())));

        return new GatewayConfig(
            Path.of(expandHome(dataDir)),
            parseStreamConfig(stream),
            parseRefreshCommands(oauth)
        );
    }

    private static StreamConfig parseStreamConfig(Map<String, Object> stream) {
        var defaults = StreamConfig.defaults();
        var threshold = Integer.parseInt(String.valueOf(
            stream.getOrDefault("compaction-threshold", defaults.compactionThreshold())));
        if (threshold < 1) {
            throw new IllegalArgumentException("stream.compaction-threshold must be positive: " + threshold);
        }
        return new StreamConfig(
            String.valueOf(stream.getOrDefault("command", defaults.command())),
            String.valueOf(stream.getOrDefault("channel-prefix", defaults.channelPrefix())),
            threshold
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> parseRefreshCommands(Map<String, Object> oauth) {
        var commands = new HashMap<>(GatewayConfig.DEFAULT_OAUTH_REFRESH_COMMANDS);
        var configured = (Map<String, Object>) oauth.getOrDefault("refresh-commands", Map.of());
        configured.forEach((k, v) -> commands.put(k, String.valueOf(v)));
        return Map.copyOf(commands);
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
