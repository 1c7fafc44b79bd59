package com.example.revisiondiff.infrastructure.persistence;

import com.example.revisiondiff.application.VersionHistoryRepository;
import com.example.revisiondiff.domain.TextVersion;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps each document's history as a JSON array in {@code <directory>/<documentId>.json}.
 *
 * <p>A store writes the whole array to {@code <documentId>.json.tmp} and then moves it over the
 * previous file, so readers see either the old or the new history, never a partial one. Callers
 * serialize stores of the same document.
 */
@Repository
public class JsonFileVersionHistoryRepository implements VersionHistoryRepository {
    private static final Logger log = LogManager.getLogger(JsonFileVersionHistoryRepository.class);
    private static final String EXTENSION = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final TypeReference<List<StoredTextVersion>> HISTORY_TYPE = new TypeReference<>() {};

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final ObjectWriter historyWriter;

    public JsonFileVersionHistoryRepository(
            @Value("${revision.storage.directory:./cache/versions}") String directory,
            ObjectMapper objectMapper) {
        this.directory = Path.of(directory).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.historyWriter = objectMapper.writerFor(HISTORY_TYPE).withDefaultPrettyPrinter();
        log.info("Storing version histories under {}", this.directory);
    }

    @Override
    public List<TextVersion> load(String documentId) throws IOException {
        Path file = fileFor(documentId);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<StoredTextVersion> stored;
        try (InputStream in = Files.newInputStream(file)) {
            stored = objectMapper.readValue(in, HISTORY_TYPE);
        }
        if (stored == null) {
            return List.of();
        }
        List<TextVersion> history = new ArrayList<>(stored.size());
        for (StoredTextVersion entry : stored) {
            if (entry == null || !entry.isComplete()) {
                throw new IOException("Incomplete version entry in " + file);
            }
            try {
                history.add(entry.toVersion());
            } catch (DateTimeParseException ex) {
                throw new IOException("Unreadable timestamp in " + file, ex);
            }
        }
        return history;
    }

    @Override
    public void store(String documentId, List<TextVersion> history) throws IOException {
        Path file = fileFor(documentId);
        Path temp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
        Files.createDirectories(directory);

        List<StoredTextVersion> stored = history.stream().map(StoredTextVersion::from).toList();
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                historyWriter.writeValue(out, stored);
            }
            moveIntoPlace(temp, file);
        } catch (IOException ex) {
            Files.deleteIfExists(temp);
            throw ex;
        }
    }

    @Override
    public void delete(String documentId) throws IOException {
        Path file = fileFor(documentId);
        Files.deleteIfExists(file.resolveSibling(file.getFileName() + TEMP_SUFFIX));
        Files.deleteIfExists(file);
    }

    Path fileFor(String documentId) {
        Path file = directory.resolve(documentId + EXTENSION).normalize();
        if (!directory.equals(file.getParent())) {
            throw new IllegalArgumentException("Document id escapes the storage directory: " + documentId);
        }
        return file;
    }

    private void moveIntoPlace(Path temp, Path file) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, replacing in place", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
