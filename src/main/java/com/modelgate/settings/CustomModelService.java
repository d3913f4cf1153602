package com.modelgate.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.modelgate.models.ModelDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes {@code custom-models.json}.
 */
public class CustomModelService {

    private static final Logger log = LoggerFactory.getLogger(CustomModelService.class);

    static final int VERSION = 1;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Document(int version, Map<String, ModelDescriptor> models) {
        public Document {
            models = models != null ? new LinkedHashMap<>(models) : new LinkedHashMap<>();
        }

        static Document empty() {
            return new Document(VERSION, new LinkedHashMap<>());
        }
    }

    private final JsonDocumentFile<Document> file;

    public CustomModelService(Path path) {
        this.file = new JsonDocumentFile<>(path, Document.class, Document::empty);
    }

    public Map<String, ModelDescriptor> getCustomModels() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(file.read().models()));
    }

    public boolean contains(String modelKey) {
        return file.read().models().containsKey(modelKey);
    }

    /** Adds or replaces one model. */
    public synchronized void add(String modelKey, ModelDescriptor model) {
        addAll(Collections.singletonMap(modelKey, model));
    }

    public synchronized void addAll(Map<String, ModelDescriptor> models) {
        for (var entry : models.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("Model key is required");
            }
            if (entry.getValue() == null || entry.getValue().providers().isEmpty()) {
                throw new IllegalArgumentException("Model " + entry.getKey() + " must list at least one provider");
            }
        }
        var updated = new LinkedHashMap<>(file.read().models());
        updated.putAll(models);
        file.write(new Document(VERSION, updated));
        log.info("Saved {} custom model(s), {} total", models.size(), updated.size());
    }

    /** @return true when a model was removed */
    public synchronized boolean remove(String modelKey) {
        var current = file.read().models();
        if (!current.containsKey(modelKey)) return false;
        var updated = new LinkedHashMap<>(current);
        updated.remove(modelKey);
        file.write(new Document(VERSION, updated));
        log.info("Removed custom model {}", modelKey);
        return true;
    }

    /** Drops the cached document so the next read goes to disk. */
    public void reload() {
        file.invalidate();
    }

    public Path path() {
        return file.file();
    }
}
