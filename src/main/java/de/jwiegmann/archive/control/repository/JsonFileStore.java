package de.jwiegmann.archive.control.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ein JSON-Dokument pro Schlüssel in einem Verzeichnis.
 * Schreibt über eine temporäre Datei und atomaren Move, damit ein Absturz keine halben Dokumente hinterlässt.
 */
@Slf4j
public class JsonFileStore<T> {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Class<T> type;
    private final ObjectMapper objectMapper;

    public JsonFileStore(Path directory, Class<T> type, ObjectMapper objectMapper) {
        this.directory = directory;
        this.type = type;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create store directory " + directory, e);
        }
    }

    public Path pathOf(String key) {
        return directory.resolve(key + SUFFIX);
    }

    public void write(String key, T value) {
        Path target = pathOf(key);
        Path tmp = directory.resolve(key + SUFFIX + ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write " + target, e);
        }
    }

    public Optional<T> read(String key) {
        Path path = pathOf(key);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + path, e);
        }
    }

    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(pathOf(key));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot delete " + pathOf(key), e);
        }
    }

    /**
     * Lädt alle Dokumente. Nicht lesbare Dateien werden übersprungen und geloggt.
     */
    public List<T> readAll() {
        List<T> result = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path path : stream) {
                try {
                    result.add(objectMapper.readValue(path.toFile(), type));
                } catch (IOException e) {
                    log.warn("Skipping unreadable record {}: {}", path, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + directory, e);
        }
        return result;
    }
}
