package com.example.revisiondiff.domain;

/**
 * Stable identifiers an API layer can map failures of this engine to.
 */
public enum ErrorCode {
    VALIDATION_FAILED,
    PERSISTENCE_FAULT,
    RESOURCE_LIMIT_EXCEEDED
}
