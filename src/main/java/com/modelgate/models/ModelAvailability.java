package com.modelgate.models;

import com.modelgate.auth.CredentialSet;
import com.modelgate.providers.CustomProviderConfig;
import com.modelgate.providers.ProviderFactory;
import com.modelgate.providers.ProviderRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Pure functions over credentials and model descriptors. Same inputs, same
 * outputs; nothing here caches or mutates.
 */
public final class ModelAvailability {

    private ModelAvailability() {}

    /**
     * Every (model, provider) pairing whose provider is registered and usable,
     * in model order then declared provider order.
     */
    public static List<AvailableModel> computeAvailableModels(CredentialSet credentials,
                                                              ProviderRegistry registry,
                                                              List<CustomProviderConfig> customProviders,
                                                              Map<String, ModelDescriptor> models,
                                                              Instant now) {
        var customs = ProviderFactory.byId(customProviders);
        var result = new ArrayList<AvailableModel>();
        for (var entry : models.entrySet()) {
            var key = entry.getKey();
            var model = entry.getValue();
            for (var providerId : model.providers()) {
                if (!usable(providerId, credentials, registry, customs, now)) continue;
                var def = registry.get(providerId);
                result.add(new AvailableModel(
                        key,
                        model.name() != null ? model.name() : key,
                        providerId,
                        def.name(),
                        model.imageInput(),
                        model.imageOutput(),
                        model.audioInput(),
                        model.videoInput(),
                        model.pricing() != null ? model.pricing().input() : null));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * An explicit {@code @provider} suffix wins when that provider is usable.
     * Otherwise the first usable provider in the model's declared order.
     * Providers missing from the registry never count as usable.
     *
     * @return the provider id, or null when none is usable or the model is unknown
     */
    public static String getBestProvider(String modelIdentifier,
                                         Map<String, ModelDescriptor> models,
                                         CredentialSet credentials,
                                         ProviderRegistry registry,
                                         List<CustomProviderConfig> customProviders,
                                         Instant now) {
        var id = ModelIdentifier.parse(modelIdentifier);
        var customs = ProviderFactory.byId(customProviders);
        if (id.hasProvider() && usable(id.providerId(), credentials, registry, customs, now)) {
            return id.providerId();
        }
        var model = models.get(id.modelKey());
        if (model == null) return null;
        for (var providerId : model.providers()) {
            if (usable(providerId, credentials, registry, customs, now)) return providerId;
        }
        return null;
    }

    public static boolean isModelAvailable(String modelIdentifier,
                                           Map<String, ModelDescriptor> models,
                                           CredentialSet credentials,
                                           ProviderRegistry registry,
                                           List<CustomProviderConfig> customProviders,
                                           Instant now) {
        return getBestProvider(modelIdentifier, models, credentials, registry, customProviders, now) != null;
    }

    private static boolean usable(String providerId, CredentialSet credentials, ProviderRegistry registry,
                                  Map<String, CustomProviderConfig> customs, Instant now) {
        return registry.contains(providerId) && ProviderFactory.isUsable(providerId, credentials, customs, now);
    }

    public static String resolveProviderModelName(String modelKey, String providerId,
                                                  Map<String, ModelDescriptor> models) {
        var model = models.get(modelKey);
        return model != null ? model.providerModelName(modelKey, providerId) : modelKey;
    }

    /**
     * Lowest input price among priced entries; ties keep list order.
     *
     * @return null when no entry carries input pricing
     */
    public static AvailableModel cheapest(List<AvailableModel> available) {
        return available.stream()
                .filter(m -> m.inputPricing() != null)
                .min(Comparator.comparingDouble(m -> ModelPricing.parse(m.inputPricing())))
                .orElse(null);
    }
}
