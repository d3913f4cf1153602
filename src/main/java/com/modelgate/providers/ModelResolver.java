package com.modelgate.providers;

/**
 * Resolves a provider-side model name into a callable handle bound to one
 * provider's endpoint and credentials.
 */
@FunctionalInterface
public interface ModelResolver {

    CallableModel resolve(String modelName);
}
