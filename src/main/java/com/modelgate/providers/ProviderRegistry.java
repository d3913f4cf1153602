package com.modelgate.providers;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable id → definition map. Built-ins come first in declaration order,
 * followed by custom providers in the order they were supplied.
 */
public final class ProviderRegistry {

    private final Map<String, ProviderDefinition> definitions;

    ProviderRegistry(Map<String, ProviderDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public ProviderDefinition get(String providerId) {
        return definitions.get(providerId);
    }

    public boolean contains(String providerId) {
        return definitions.containsKey(providerId);
    }

    public Set<String> ids() {
        return definitions.keySet();
    }

    public Collection<ProviderDefinition> all() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProviderRegistry other && definitions.equals(other.definitions);
    }

    @Override
    public int hashCode() {
        return definitions.hashCode();
    }
}
