package com.modelgate.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Merges the built-in provider table with custom entries. Pure: no I/O, same
 * input gives an equal registry.
 */
public class ProviderRegistryBuilder {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistryBuilder.class);

    public static ProviderRegistry build(List<CustomProviderConfig> customProviders) {
        var merged = new LinkedHashMap<>(BuiltinProviders.definitions());
        if (customProviders == null) return new ProviderRegistry(merged);

        for (var custom : customProviders) {
            if (custom == null || custom.id() == null || custom.id().isBlank()) {
                log.warn("Skipping custom provider without id");
                continue;
            }
            var builtin = BuiltinProviders.definitions().get(custom.id());
            if (builtin != null) {
                merged.put(custom.id(), builtin.overriddenBy(custom));
                continue;
            }
            var problem = validate(custom);
            if (problem != null) {
                log.warn("Skipping custom provider '{}': {}", custom.id(), problem);
                continue;
            }
            if (merged.containsKey(custom.id())) {
                log.warn("Custom provider '{}' defined more than once, last definition wins", custom.id());
            }
            merged.put(custom.id(), ProviderDefinition.fromCustom(custom));
        }
        return new ProviderRegistry(merged);
    }

    private static String validate(CustomProviderConfig custom) {
        if (custom.type() == null) return "missing type";
        if (custom.baseUrl() == null || custom.baseUrl().isBlank()) return "missing baseUrl";
        try {
            var uri = URI.create(custom.baseUrl());
            if (uri.getScheme() == null || uri.getHost() == null) return "invalid baseUrl " + custom.baseUrl();
        } catch (IllegalArgumentException e) {
            return "invalid baseUrl " + custom.baseUrl();
        }
        return null;
    }
}
