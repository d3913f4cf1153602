package com.modelgate.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.modelgate.shared.model.Mappers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * A JSON document persisted to one file, cached after the first read.
 * Writes go through a sibling temp file.
 */
final class JsonDocumentFile<T> {

    private static final ObjectMapper MAPPER = Mappers.json().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;
    private final Class<T> type;
    private final Supplier<T> empty;
    private T cached;

    JsonDocumentFile(Path file, Class<T> type, Supplier<T> empty) {
        this.file = file;
        this.type = type;
        this.empty = empty;
    }

    synchronized T read() {
        if (cached != null) return cached;
        if (!Files.exists(file)) {
            cached = empty.get();
            return cached;
        }
        try {
            var value = MAPPER.readValue(file.toFile(), type);
            cached = value != null ? value : empty.get();
            return cached;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    synchronized void write(T document) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            var tmp = file.resolveSibling(file.getFileName() + ".tmp");
            MAPPER.writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            cached = document;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    synchronized void invalidate() {
        cached = null;
    }

    Path file() {
        return file;
    }
}
