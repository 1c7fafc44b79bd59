package com.example.revisiondiff.domain;

/**
 * A document history could not be written. The in-memory history is unchanged.
 */
public class VersionPersistenceException extends RevisionException {
    private final String documentId;

    public VersionPersistenceException(String documentId, String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAULT, message, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
