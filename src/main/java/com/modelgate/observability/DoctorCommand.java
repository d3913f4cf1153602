package com.modelgate.observability;

import com.modelgate.models.ModelIdentifier;
import com.modelgate.shared.config.GatewayConfig;
import com.modelgate.store.ProviderStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class DoctorCommand {

    private final ProviderStore store;
    private final GatewayConfig config;

    public DoctorCommand(ProviderStore store, GatewayConfig config) {
        this.store = store;
        this.config = config;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkInitialized());
        results.addAll(checkLoadFailures());
        results.add(checkProviders());
        results.add(checkModels());
        results.add(checkFile("Settings file", config.settingsFile()));
        results.add(checkFile("Custom providers file", config.customProvidersFile()));
        results.add(checkFile("Custom models file", config.customModelsFile()));
        return String.join("\n", results);
    }

    private String checkInitialized() {
        var snapshot = store.snapshot();
        if (!snapshot.initialized()) return "[WARN] Provider store not initialized";
        if (snapshot.error() != null) return "[FAIL] Provider store load failed: " + snapshot.error();
        return "[OK] Provider store initialized";
    }

    private List<String> checkLoadFailures() {
        return store.snapshot().loadFailures().stream()
                .map(f -> "[WARN] Degraded: " + f)
                .toList();
    }

    private String checkProviders() {
        var providers = store.snapshot().providers().keySet();
        return providers.isEmpty()
                ? "[FAIL] No usable providers. Configure an API key or connect an OAuth account"
                : "[OK] Usable providers: " + String.join(", ", providers);
    }

    private String checkModels() {
        var available = store.availableModels();
        if (available.isEmpty()) return "[FAIL] No available models";
        var cheapest = store.getAvailableModel();
        return "[OK] " + available.size() + " available models"
                + (cheapest != null
                        ? ", cheapest: " + ModelIdentifier.format(cheapest.key(), cheapest.provider())
                        : "");
    }

    private String checkFile(String label, Path path) {
        return Files.isRegularFile(path)
                ? "[OK] " + label + " " + path
                : "[WARN] " + label + " not found at " + path + " (defaults in use)";
    }
}
