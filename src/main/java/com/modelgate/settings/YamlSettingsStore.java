package com.modelgate.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link SettingsStore} backed by a single flat YAML file. The file is read
 * once and rewritten in full on every change.
 */
public class YamlSettingsStore implements SettingsStore {

    private static final Logger log = LoggerFactory.getLogger(YamlSettingsStore.class);

    private final Path file;
    private Map<String, String> values;

    public YamlSettingsStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized String get(String key) {
        return values().get(key);
    }

    @Override
    public synchronized void set(String key, String value) {
        var updated = new TreeMap<>(values());
        if (value == null || value.isBlank()) {
            if (updated.remove(key) == null) return;
        } else {
            updated.put(key, value);
        }
        write(updated);
        values = updated;
        log.debug("Setting {} {}", key, value == null || value.isBlank() ? "removed" : "updated");
    }

    @Override
    public synchronized Map<String, String> getBatch(Collection<String> keys) {
        var current = values();
        var result = new TreeMap<String, String>();
        for (var key : keys) {
            var value = current.get(key);
            if (value != null) result.put(key, value);
        }
        return result;
    }

    @Override
    public synchronized Map<String, String> getByPrefix(String prefix) {
        var result = new TreeMap<String, String>();
        values().forEach((k, v) -> {
            if (k.startsWith(prefix)) result.put(k, v);
        });
        return result;
    }

    public Path file() {
        return file;
    }

    private Map<String, String> values() {
        if (values == null) values = read();
        return values;
    }

    private Map<String, String> read() {
        var result = new TreeMap<String, String>();
        if (!Files.exists(file)) return result;
        try {
            Map<String, Object> raw = new Yaml().load(Files.readString(file, StandardCharsets.UTF_8));
            if (raw != null) {
                raw.forEach((k, v) -> {
                    if (v != null) result.put(k, String.valueOf(v));
                });
            }
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings: " + file, e);
        }
    }

    private void write(Map<String, String> content) {
        var options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        var text = new Yaml(options).dump(content);
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            var tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write settings: " + file, e);
        }
    }
}
