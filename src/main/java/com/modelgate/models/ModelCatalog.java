package com.modelgate.models;

import com.fasterxml.jackson.core.type.TypeReference;
import com.modelgate.shared.model.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in model descriptors, in authored order, loaded once from the
 * classpath.
 */
public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    public static final String DEFAULT_RESOURCE = "models/default-models.json";

    private static final TypeReference<LinkedHashMap<String, ModelDescriptor>> TYPE = new TypeReference<>() {};

    private final Map<String, ModelDescriptor> builtin;

    public ModelCatalog(Map<String, ModelDescriptor> builtin) {
        this.builtin = Collections.unmodifiableMap(new LinkedHashMap<>(builtin));
    }

    public static ModelCatalog loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static ModelCatalog fromResource(String resource) {
        try (InputStream in = ModelCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Model catalog resource {} not found, starting with no built-in models", resource);
                return new ModelCatalog(Map.of());
            }
            Map<String, ModelDescriptor> models = Mappers.json().readValue(in, TYPE);
            log.info("Loaded {} built-in models", models.size());
            return new ModelCatalog(models);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model catalog " + resource, e);
        }
    }

    public Map<String, ModelDescriptor> builtin() {
        return builtin;
    }

    /**
     * Built-in models overlaid with custom ones. A custom key matching a
     * built-in replaces it in place; new keys follow in their own order.
     */
    public Map<String, ModelDescriptor> merged(Map<String, ModelDescriptor> custom) {
        var result = new LinkedHashMap<>(builtin);
        if (custom != null) result.putAll(custom);
        return Collections.unmodifiableMap(result);
    }
}
