package com.modelgate.store;

import com.modelgate.auth.CredentialSet;
import com.modelgate.models.AvailableModel;
import com.modelgate.models.ModelDescriptor;
import com.modelgate.providers.CustomProviderConfig;
import com.modelgate.providers.ModelResolver;
import com.modelgate.providers.ProviderRegistry;
import com.modelgate.providers.ProviderRegistryBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the store knows at one point in time. Never modified after
 * construction; the store swaps whole snapshots.
 *
 * @param error message of the last failed load, or null
 */
public record ProviderSnapshot(
    CredentialSet credentials,
    List<CustomProviderConfig> customProviders,
    Map<String, ModelDescriptor> customModels,
    ProviderRegistry registry,
    Map<String, ModelDescriptor> models,
    Map<String, ModelResolver> providers,
    List<AvailableModel> availableModels,
    boolean initialized,
    String error,
    List<String> loadFailures
) {
    public ProviderSnapshot {
        customProviders = List.copyOf(customProviders);
        customModels = Collections.unmodifiableMap(new LinkedHashMap<>(customModels));
        models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        availableModels = List.copyOf(availableModels);
        loadFailures = List.copyOf(loadFailures);
    }

    public static ProviderSnapshot empty(Map<String, ModelDescriptor> builtinModels) {
        return new ProviderSnapshot(CredentialSet.empty(), List.of(), Map.of(), ProviderRegistryBuilder.build(List.of()),
                builtinModels, Map.of(), List.of(), false, null, List.of());
    }

    ProviderSnapshot failed(String message) {
        return new ProviderSnapshot(credentials, customProviders, customModels, registry, models, providers,
                availableModels, true, message, loadFailures);
    }
}
