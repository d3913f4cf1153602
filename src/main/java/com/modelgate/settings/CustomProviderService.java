package com.modelgate.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.providers.BuiltinProviders;
import com.modelgate.providers.CustomProviderConfig;
import com.modelgate.shared.model.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes {@code custom-providers.json}.
 */
public class CustomProviderService {

    private static final Logger log = LoggerFactory.getLogger(CustomProviderService.class);

    private static final ObjectMapper MAPPER = Mappers.json();

    static final int VERSION = 1;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Document(int version, Map<String, CustomProviderConfig> providers) {
        public Document {
            providers = providers != null ? new LinkedHashMap<>(providers) : new LinkedHashMap<>();
        }

        /** Entries are converted one by one; a malformed entry is skipped, not the whole file. */
        @JsonCreator
        static Document fromJson(@JsonProperty("version") Integer version,
                                 @JsonProperty("providers") Map<String, JsonNode> raw) {
            var providers = new LinkedHashMap<String, CustomProviderConfig>();
            if (raw != null) {
                raw.forEach((id, node) -> {
                    try {
                        var config = MAPPER.treeToValue(node, CustomProviderConfig.class);
                        if (config != null) providers.put(id, config);
                    } catch (JsonProcessingException | IllegalArgumentException e) {
                        log.warn("Skipping malformed custom provider '{}': {}", id, e.getMessage());
                    }
                });
            }
            return new Document(version != null ? version : VERSION, providers);
        }

        static Document empty() {
            return new Document(VERSION, new LinkedHashMap<>());
        }
    }

    public record ValidationResult(List<String> errors, List<String> warnings) {
        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    private final JsonDocumentFile<Document> file;

    public CustomProviderService(Path path) {
        this.file = new JsonDocumentFile<>(path, Document.class, Document::empty);
    }

    /** All entries in file order, with the map key as id. */
    public List<CustomProviderConfig> list() {
        var result = new ArrayList<CustomProviderConfig>();
        file.read().providers().forEach((id, config) -> {
            if (config != null) result.add(config.withId(id));
        });
        return result;
    }

    public List<CustomProviderConfig> listEnabled() {
        return list().stream().filter(CustomProviderConfig::isEnabled).toList();
    }

    /** Returns the entry, or null. */
    public CustomProviderConfig get(String providerId) {
        var config = file.read().providers().get(providerId);
        return config != null ? config.withId(providerId) : null;
    }

    /**
     * Adds a provider. A missing id is generated from type and name.
     *
     * @return the stored entry
     * @throws IllegalArgumentException when validation fails or the id is taken
     */
    public synchronized CustomProviderConfig add(CustomProviderConfig config) {
        var id = config.id() != null && !config.id().isBlank()
                ? config.id()
                : generateId(config.type() != null ? config.type().wireName() : "custom", config.name());
        var stored = config.withId(id);
        var validation = validate(stored);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid custom provider: " + String.join("; ", validation.errors()));
        }
        validation.warnings().forEach(w -> log.warn("Custom provider {}: {}", id, w));

        var doc = file.read();
        if (doc.providers().containsKey(id)) {
            throw new IllegalArgumentException("Custom provider already exists: " + id);
        }
        var providers = new LinkedHashMap<>(doc.providers());
        providers.put(id, stored);
        file.write(new Document(VERSION, providers));
        log.info("Added custom provider {} ({})", id, stored.type() != null ? stored.type().wireName() : "?");
        return stored;
    }

    /**
     * Merges the non-null fields of {@code patch} into an existing entry.
     *
     * @throws IllegalArgumentException when the id is unknown or the merged entry is invalid
     */
    public synchronized CustomProviderConfig update(String providerId, CustomProviderConfig patch) {
        var doc = file.read();
        var existing = doc.providers().get(providerId);
        if (existing == null) {
            throw new IllegalArgumentException("Custom provider not found: " + providerId);
        }
        var merged = existing.withId(providerId).merge(patch);
        var validation = validate(merged);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid custom provider: " + String.join("; ", validation.errors()));
        }
        var providers = new LinkedHashMap<>(doc.providers());
        providers.put(providerId, merged);
        file.write(new Document(VERSION, providers));
        log.info("Updated custom provider {}", providerId);
        return merged;
    }

    /** @return true when an entry was removed */
    public synchronized boolean remove(String providerId) {
        var doc = file.read();
        if (!doc.providers().containsKey(providerId)) return false;
        var providers = new LinkedHashMap<>(doc.providers());
        providers.remove(providerId);
        file.write(new Document(VERSION, providers));
        log.info("Removed custom provider {}", providerId);
        return true;
    }

    public ValidationResult validate(CustomProviderConfig config) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        if (isBlank(config.name())) errors.add("name is required");
        if (config.type() == null) errors.add("type is required");
        if (isBlank(config.apiKey())) errors.add("apiKey is required");
        if (isBlank(config.baseUrl())) {
            errors.add("baseUrl is required");
        } else {
            try {
                var uri = URI.create(config.baseUrl());
                if (uri.getScheme() == null || uri.getHost() == null) {
                    errors.add("baseUrl is not a valid URL");
                } else if (!uri.getScheme().equals("http") && !uri.getScheme().equals("https")) {
                    errors.add("baseUrl must use http or https");
                } else if (isLocal(uri.getHost())) {
                    warnings.add("baseUrl points at a local address");
                }
            } catch (IllegalArgumentException e) {
                errors.add("baseUrl is not a valid URL");
            }
        }
        if (config.id() != null && BuiltinProviders.isBuiltin(config.id())) {
            warnings.add("id overrides built-in provider " + config.id());
        }
        return new ValidationResult(List.copyOf(errors), List.copyOf(warnings));
    }

    /** {@code <type>-<slug(name)>}, suffixed with a counter when taken. */
    public String generateId(String type, String name) {
        var slug = slug(name);
        var base = type + "-" + (slug.isEmpty() ? "provider" : slug);
        var taken = file.read().providers().keySet();
        var id = base;
        for (int i = 2; taken.contains(id) || BuiltinProviders.isBuiltin(id); i++) {
            id = base + "-" + i;
        }
        return id;
    }

    /** Drops the cached document so the next read goes to disk. */
    public void reload() {
        file.invalidate();
    }

    public Path path() {
        return file.file();
    }

    static String slug(String name) {
        if (name == null) return "";
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
    }

    private static boolean isLocal(String host) {
        return host.equals("localhost") || host.equals("127.0.0.1") || host.equals("0.0.0.0") || host.equals("[::1]");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
