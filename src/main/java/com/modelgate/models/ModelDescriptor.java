package com.modelgate.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * A logical model and the providers able to serve it. The provider list is a
 * priority order: the first usable entry wins.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelDescriptor(
    String name,
    boolean imageInput,
    boolean imageOutput,
    boolean audioInput,
    boolean videoInput,
    boolean interleaved,
    List<String> providers,
    Map<String, String> providerMappings,
    ModelPricing pricing,
    Integer contextLength
) {
    public ModelDescriptor {
        providers = providers != null ? List.copyOf(providers) : List.of();
        providerMappings = providerMappings != null ? Map.copyOf(providerMappings) : Map.of();
    }

    public static ModelDescriptor of(String name, List<String> providers) {
        return new ModelDescriptor(name, false, false, false, false, false, providers, Map.of(), null, null);
    }

    /** Provider-side model name, or {@code modelKey} when no mapping exists. */
    public String providerModelName(String modelKey, String providerId) {
        var mapped = providerMappings.get(providerId);
        return mapped != null && !mapped.isBlank() ? mapped : modelKey;
    }
}
