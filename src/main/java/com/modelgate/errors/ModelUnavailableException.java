package com.modelgate.errors;

/**
 * No provider with a usable credential can serve the requested model.
 * A configuration problem; never retried automatically.
 */
public class ModelUnavailableException extends GatewayException {

    private final String modelKey;

    public ModelUnavailableException(String modelKey) {
        super("MODEL_UNAVAILABLE",
                "No available provider for model: " + modelKey + ". Please configure API keys in settings.");
        this.modelKey = modelKey;
    }

    public String modelKey() {
        return modelKey;
    }
}
