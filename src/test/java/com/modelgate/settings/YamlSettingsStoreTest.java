package com.modelgate.settings;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YamlSettingsStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileReadsAsEmpty() {
        var store = new YamlSettingsStore(tempDir.resolve("settings.yaml"));
        assertNull(store.get("api_key_openai"));
        assertTrue(store.getByPrefix("api_key_").isEmpty());
    }

    @Test
    void valuesPersistAcrossInstances() {
        var file = tempDir.resolve("nested/settings.yaml");
        var store = new YamlSettingsStore(file);
        store.set("api_key_openai", "sk-1");
        store.set("use_coding_plan_zhipu", "true");

        var reopened = new YamlSettingsStore(file);
        assertEquals("sk-1", reopened.get("api_key_openai"));
        assertEquals("true", reopened.get("use_coding_plan_zhipu"));
        assertFalse(Files.exists(file.resolveSibling("settings.yaml.tmp")));
    }

    @Test
    void blankValueRemovesKey() {
        var store = new YamlSettingsStore(tempDir.resolve("settings.yaml"));
        store.set("base_url_openai", "https://proxy.example");
        store.set("base_url_openai", "");
        assertNull(store.get("base_url_openai"));
        assertNull(new YamlSettingsStore(store.file()).get("base_url_openai"));
    }

    @Test
    void batchReturnsOnlyPresentKeys() {
        var store = new YamlSettingsStore(tempDir.resolve("settings.yaml"));
        store.set("api_key_a", "1");
        store.set("api_key_b", "2");
        store.set("base_url_a", "u");

        assertEquals(Map.of("api_key_a", "1"), store.getBatch(List.of("api_key_a", "api_key_z")));
        assertEquals(Map.of("api_key_a", "1", "api_key_b", "2"), store.getByPrefix("api_key_"));
    }

    @Test
    void nonStringYamlValuesReadAsText() throws IOException {
        var file = tempDir.resolve("settings.yaml");
        Files.writeString(file, """
            use_international_moonshot: true
            oauth_openai_expires_at: 1767225600000
            """);
        var store = new YamlSettingsStore(file);
        assertEquals("true", store.get("use_international_moonshot"));
        assertEquals("1767225600000", store.get("oauth_openai_expires_at"));
    }

    @Test
    void unreadableFileFailsLoudly() throws IOException {
        var file = tempDir.resolve("settings.yaml");
        Files.createDirectories(file);
        var store = new YamlSettingsStore(file);
        assertThrows(UncheckedIOException.class, () -> store.get("x"));
    }
}
