package com.modelgate.observability;

import com.modelgate.auth.CredentialSet;
import com.modelgate.models.AvailableModel;
import com.modelgate.providers.ModelResolver;
import com.modelgate.providers.ProviderRegistryBuilder;
import com.modelgate.shared.config.GatewayConfig;
import com.modelgate.shared.config.StreamConfig;
import com.modelgate.store.ProviderSnapshot;
import com.modelgate.store.ProviderStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DoctorCommandTest {

    @TempDir
    Path tempDir;

    private GatewayConfig config() {
        return new GatewayConfig(tempDir, StreamConfig.defaults(), Map.of());
    }

    private static ProviderSnapshot snapshot(Map<String, ModelResolver> providers, boolean initialized,
                                             String error, List<String> failures) {
        return new ProviderSnapshot(CredentialSet.empty(), List.of(), Map.of(), ProviderRegistryBuilder.build(List.of()),
                Map.of(), providers, List.of(), initialized, error, failures);
    }

    private static AvailableModel model(String key, String provider, String price) {
        return new AvailableModel(key, key, provider, provider, false, false, false, false, price);
    }

    @Test
    void healthyStore() throws IOException {
        Files.writeString(config().settingsFile(), "api_key_deepseek: sk\n");
        var store = mock(ProviderStore.class);
        ModelResolver resolver = name -> null;
        when(store.snapshot()).thenReturn(snapshot(Map.of("deepseek", resolver), true, null, List.of()));
        var models = List.of(model("deepseek-chat", "deepseek", "0.28"));
        when(store.availableModels()).thenReturn(models);
        when(store.getAvailableModel()).thenReturn(models.get(0));

        var report = new DoctorCommand(store, config()).run();

        assertTrue(report.contains("[OK] Provider store initialized"));
        assertTrue(report.contains("[OK] Usable providers: deepseek"));
        assertTrue(report.contains("[OK] 1 available models, cheapest: deepseek-chat@deepseek"));
        assertTrue(report.contains("[OK] Settings file " + config().settingsFile()));
        assertTrue(report.contains("[WARN] Custom providers file not found"));
        assertFalse(report.contains("[FAIL]"));
    }

    @Test
    void uninitializedStoreReportsNoProviders() {
        var store = mock(ProviderStore.class);
        when(store.snapshot()).thenReturn(snapshot(Map.of(), false, null, List.of()));
        when(store.availableModels()).thenReturn(List.of());

        var lines = new DoctorCommand(store, config()).run().split("\n");

        assertEquals("[WARN] Provider store not initialized", lines[0]);
        assertTrue(lines[1].startsWith("[FAIL] No usable providers"));
        assertEquals("[FAIL] No available models", lines[2]);
    }

    @Test
    void failedAndDegradedLoadsAreReported() {
        var store = mock(ProviderStore.class);
        when(store.snapshot()).thenReturn(snapshot(Map.of(), true, "disk gone", List.of("custom models: bad json")));
        when(store.availableModels()).thenReturn(List.of());

        var report = new DoctorCommand(store, config()).run();

        assertTrue(report.contains("[FAIL] Provider store load failed: disk gone"));
        assertTrue(report.contains("[WARN] Degraded: custom models: bad json"));
    }
}
