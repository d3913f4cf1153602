package com.modelgate.models;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AvailableModel(
    String key,
    String name,
    String provider,
    String providerName,
    boolean imageInput,
    boolean imageOutput,
    boolean audioInput,
    boolean videoInput,
    String inputPricing
) {
    /** Identifier that pins this pairing: {@code key@provider}. */
    public String identifier() {
        return ModelIdentifier.format(key, provider);
    }
}
