package com.example.revisiondiff.application;

import com.example.revisiondiff.domain.ComparisonRequest;
import com.example.revisiondiff.domain.DiffResult;
import com.example.revisiondiff.domain.Granularity;
import com.example.revisiondiff.domain.TextVersion;
import com.example.revisiondiff.domain.ValidationException;
import com.example.revisiondiff.domain.VersionPersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Ordered history of immutable snapshots per document.
 *
 * <p>Each document id has its own lock: loading, saving and clearing one document are
 * serialized, while different documents proceed independently. Every save rewrites the
 * document's whole history through the {@link VersionHistoryRepository}. Read failures are
 * logged and degrade to an empty history; a failed write is logged, reported as
 * {@link VersionPersistenceException} and leaves the history as it was.
 *
 * <p>A document becomes resident once it is saved, cleared, or read while it has a stored
 * history. Resident histories stay in memory for the lifetime of the store; reads of documents
 * with nothing stored are answered without keeping an entry.
 */
@Service
public class VersionStore {
    private static final Logger log = LogManager.getLogger(VersionStore.class);
    private static final Pattern DOCUMENT_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");
    private static final int VERSION_ID_LENGTH = 12;

    private final VersionHistoryRepository repository;
    private final TextComparisonUseCase comparisonUseCase;
    private final Clock clock;
    private final ConcurrentMap<String, DocumentHistory> histories = new ConcurrentHashMap<>();

    public VersionStore(
            VersionHistoryRepository repository, TextComparisonUseCase comparisonUseCase, Clock clock) {
        this.repository = repository;
        this.comparisonUseCase = comparisonUseCase;
        this.clock = clock;
    }

    public TextVersion save(String documentId, String content, String label, String style) {
        validateDocumentId(documentId);
        if (content == null) {
            throw new ValidationException("Content is required");
        }
        DocumentHistory history = historyOf(documentId);
        history.lock.lock();
        try {
            ensureLoaded(documentId, history);
            LocalDateTime timestamp = nextTimestamp(history.versions);
            String versionId = versionId(content, timestamp);
            if (history.versions.stream().anyMatch(v -> v.versionId().equals(versionId))) {
                log.warn("Version id {} already exists in history of {}", versionId, documentId);
            }
            TextVersion version = new TextVersion(versionId, content, timestamp, label, style);

            List<TextVersion> updated = new ArrayList<>(history.versions);
            updated.add(version);
            try {
                repository.store(documentId, updated);
            } catch (IOException ex) {
                log.warn("Failed to store version history of {}", documentId, ex);
                throw new VersionPersistenceException(
                        documentId, "Failed to store version history of " + documentId, ex);
            }
            history.versions = List.copyOf(updated);
            log.info(
                    "Saved version {} of {} ({} versions)", versionId, documentId, updated.size());
            return version;
        } finally {
            history.lock.unlock();
        }
    }

    public List<TextVersion> list(String documentId) {
        validateDocumentId(documentId);
        DocumentHistory history = histories.get(documentId);
        if (history == null) {
            List<TextVersion> stored = load(documentId);
            if (stored.isEmpty()) {
                return stored;
            }
            history = histories.computeIfAbsent(documentId, id -> new DocumentHistory(stored));
        }
        history.lock.lock();
        try {
            ensureLoaded(documentId, history);
            return history.versions;
        } finally {
            history.lock.unlock();
        }
    }

    public Optional<TextVersion> get(String documentId, String versionId) {
        if (versionId == null || versionId.isBlank()) {
            throw new ValidationException("Version id is required");
        }
        return list(documentId).stream().filter(v -> v.versionId().equals(versionId)).findFirst();
    }

    public Optional<DiffResult> compareVersions(String documentId, String versionIdA, String versionIdB) {
        return compareVersions(documentId, versionIdA, versionIdB, Granularity.CHAR);
    }

    /**
     * Empty when either version is not part of the document's history.
     */
    public Optional<DiffResult> compareVersions(
            String documentId, String versionIdA, String versionIdB, Granularity granularity) {
        Optional<TextVersion> versionA = get(documentId, versionIdA);
        Optional<TextVersion> versionB = get(documentId, versionIdB);
        if (versionA.isEmpty() || versionB.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(
                comparisonUseCase.compare(
                        new ComparisonRequest(
                                versionA.get().content(), versionB.get().content(), granularity)));
    }

    public Optional<String> unifiedDiff(
            String documentId, String versionIdA, String versionIdB, int contextSize) {
        Optional<TextVersion> versionA = get(documentId, versionIdA);
        Optional<TextVersion> versionB = get(documentId, versionIdB);
        if (versionA.isEmpty() || versionB.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(
                comparisonUseCase.unifiedDiff(
                        documentId,
                        versionA.get().content(),
                        versionB.get().content(),
                        contextSize));
    }

    /**
     * Drops the document's history and its stored file. Calling it again is harmless.
     */
    public void clear(String documentId) {
        validateDocumentId(documentId);
        DocumentHistory history = historyOf(documentId);
        history.lock.lock();
        try {
            // The entry stays in the table so that every caller keeps using the same lock.
            history.versions = List.of();
            history.loaded = true;
            try {
                repository.delete(documentId);
                log.info("Cleared version history of {}", documentId);
            } catch (IOException ex) {
                log.warn("Failed to delete stored version history of {}", documentId, ex);
            }
        } finally {
            history.lock.unlock();
        }
    }

    private DocumentHistory historyOf(String documentId) {
        return histories.computeIfAbsent(documentId, id -> new DocumentHistory());
    }

    private void ensureLoaded(String documentId, DocumentHistory history) {
        if (history.loaded) {
            return;
        }
        history.versions = load(documentId);
        history.loaded = true;
    }

    private List<TextVersion> load(String documentId) {
        try {
            return List.copyOf(repository.load(documentId));
        } catch (IOException ex) {
            log.warn("Failed to load version history of {}, starting empty", documentId, ex);
            return List.of();
        }
    }

    private LocalDateTime nextTimestamp(List<TextVersion> versions) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (versions.isEmpty()) {
            return now;
        }
        LocalDateTime last = versions.get(versions.size() - 1).timestamp();
        return now.isBefore(last) ? last : now;
    }

    static String versionId(String content, LocalDateTime timestamp) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hashBytes = digest.digest((content + timestamp).getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hashBytes.length * 2);
            for (byte b : hashBytes) {
                sb.append(String.format("%02x", b));
            }
            return sb.substring(0, VERSION_ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm is required to derive version ids", e);
        }
    }

    private static void validateDocumentId(String documentId) {
        if (documentId == null || !DOCUMENT_ID.matcher(documentId).matches()) {
            throw new ValidationException(
                    "Document id must be 1-128 characters of letters, digits, '.', '_' or '-'");
        }
        if (documentId.equals(".") || documentId.equals("..")) {
            throw new ValidationException("Document id must not be '.' or '..'");
        }
    }

    private static final class DocumentHistory {
        private final ReentrantLock lock = new ReentrantLock();
        private List<TextVersion> versions = List.of();
        private boolean loaded;

        private DocumentHistory() {}

        private DocumentHistory(List<TextVersion> stored) {
            this.versions = stored;
            this.loaded = true;
        }
    }
}
