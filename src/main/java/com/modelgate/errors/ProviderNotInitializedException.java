package com.modelgate.errors;

/**
 * A provider was selected for a model but no resolver was ever built for it.
 * Indicates an inconsistency between credentials and the provider registry.
 */
public class ProviderNotInitializedException extends GatewayException {

    private final String providerId;

    public ProviderNotInitializedException(String providerId, String modelKey) {
        super("PROVIDER_NOT_INITIALIZED",
                "Provider " + providerId + " not initialized for model: " + modelKey);
        this.providerId = providerId;
    }

    public String providerId() {
        return providerId;
    }
}
