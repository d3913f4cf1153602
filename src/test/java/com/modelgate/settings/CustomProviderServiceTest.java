package com.modelgate.settings;

import com.modelgate.providers.CustomProviderConfig;
import com.modelgate.providers.ProtocolType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CustomProviderServiceTest {

    @TempDir
    Path tempDir;

    private CustomProviderService service() {
        return new CustomProviderService(tempDir.resolve("custom-providers.json"));
    }

    private static CustomProviderConfig config(String id, String name, Boolean enabled) {
        return new CustomProviderConfig(id, name, ProtocolType.OPENAI_COMPATIBLE,
                "https://api.example.com/v1", "sk-test", enabled, null, null, null);
    }

    @Test
    void addGeneratesIdFromTypeAndName() {
        var service = service();
        var stored = service.add(config(null, "My Proxy!", true));

        assertThat(stored.id()).isEqualTo("openai-compatible-my-proxy");
        assertThat(service.get("openai-compatible-my-proxy")).isEqualTo(stored);
    }

    @Test
    void generatedIdsAvoidCollisions() {
        var service = service();
        service.add(config(null, "Proxy", true));
        var second = service.add(config(null, "Proxy", true));
        assertThat(second.id()).isEqualTo("openai-compatible-proxy-2");
    }

    @Test
    void listEnabledFiltersDisabledAndUnset() {
        var service = service();
        service.add(config("on", "On", true));
        service.add(config("off", "Off", false));
        service.add(config("unset", "Unset", null));

        assertThat(service.list()).extracting(CustomProviderConfig::id).containsExactly("on", "off", "unset");
        assertThat(service.listEnabled()).extracting(CustomProviderConfig::id).containsExactly("on");
    }

    @Test
    void updateMergesOnlyGivenFields() {
        var service = service();
        service.add(config("p", "Original", true));

        var patch = new CustomProviderConfig(null, null, null, "https://new.example.com", null, false,
                null, null, null);
        var updated = service.update("p", patch);

        assertThat(updated.name()).isEqualTo("Original");
        assertThat(updated.apiKey()).isEqualTo("sk-test");
        assertThat(updated.baseUrl()).isEqualTo("https://new.example.com");
        assertThat(updated.isEnabled()).isFalse();
        assertThat(new CustomProviderService(service.path()).get("p")).isEqualTo(updated);
    }

    @Test
    void updateUnknownIdFails() {
        assertThatThrownBy(() -> service().update("nope", config(null, "x", true)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void duplicateIdRejected() {
        var service = service();
        service.add(config("p", "P", true));
        assertThatThrownBy(() -> service.add(config("p", "P", true)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeReportsWhetherSomethingWasRemoved() {
        var service = service();
        service.add(config("p", "P", true));
        assertThat(service.remove("p")).isTrue();
        assertThat(service.remove("p")).isFalse();
        assertThat(service.list()).isEmpty();
    }

    @Test
    void validationCollectsErrorsAndWarnings() {
        var service = service();
        var missing = new CustomProviderConfig("x", null, null, "ftp://host", null, true, null, null, null);
        var result = service.validate(missing);
        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).contains("name is required", "type is required", "apiKey is required",
                "baseUrl must use http or https");

        var local = new CustomProviderConfig("openai", "Local", ProtocolType.OPENAI_COMPATIBLE,
                "http://localhost:8080", "k", true, null, null, null);
        var warnings = service.validate(local).warnings();
        assertThat(warnings).hasSize(2);
        assertThat(service.validate(local).isValid()).isTrue();
    }

    @Test
    void invalidConfigNotPersisted() {
        var service = service();
        assertThatThrownBy(() -> service.add(new CustomProviderConfig("x", "X", ProtocolType.ANTHROPIC,
                "not a url", "k", true, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(Files.exists(service.path())).isFalse();
    }

    @Test
    void corruptFileSurfacesAsUncheckedIo() throws IOException {
        Files.writeString(tempDir.resolve("custom-providers.json"), "{ not json");
        assertThatThrownBy(() -> service().list()).isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void readsDocumentWrittenByOtherTools() throws IOException {
        Files.writeString(tempDir.resolve("custom-providers.json"), """
            {"version": 1, "providers": {"acme": {
              "name": "Acme", "type": "anthropic", "baseUrl": "https://acme.example",
              "apiKey": "k", "enabled": true, "futureField": 1}}}
            """);
        var acme = service().get("acme");
        assertThat(acme.id()).isEqualTo("acme");
        assertThat(acme.type()).isEqualTo(ProtocolType.ANTHROPIC);
    }

    @Test
    void malformedEntryIsSkippedWithoutLosingTheOthers() throws IOException {
        Files.writeString(tempDir.resolve("custom-providers.json"), """
            {"version": 1, "providers": {
              "good": {"name": "Good", "type": "openai-compatible", "baseUrl": "https://good.example",
                       "apiKey": "k", "enabled": true},
              "bad": {"name": "Bad", "type": "gemini", "baseUrl": "https://bad.example",
                      "apiKey": "k", "enabled": true},
              "worse": {"name": "Worse", "headers": "not-a-map", "enabled": true}}}
            """);
        var service = service();

        assertThat(service.list()).extracting(CustomProviderConfig::id).containsExactly("good");
        assertThat(service.listEnabled()).extracting(CustomProviderConfig::id).containsExactly("good");
        assertThat(service.get("bad")).isNull();
    }
}
