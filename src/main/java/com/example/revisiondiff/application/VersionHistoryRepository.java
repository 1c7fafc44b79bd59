package com.example.revisiondiff.application;

import com.example.revisiondiff.domain.TextVersion;

import java.io.IOException;
import java.util.List;

/**
 * Durable storage of whole document histories. Every {@link #store} replaces the previous
 * history of the document.
 */
public interface VersionHistoryRepository {

    /** Stored history in insertion order; empty when nothing has been stored for the document. */
    List<TextVersion> load(String documentId) throws IOException;

    void store(String documentId, List<TextVersion> history) throws IOException;

    /** No-op when nothing is stored for the document. */
    void delete(String documentId) throws IOException;
}
