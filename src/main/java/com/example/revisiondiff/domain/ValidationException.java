package com.example.revisiondiff.domain;

/**
 * Malformed identifier or missing text. Raised before any state is touched.
 */
public class ValidationException extends RevisionException {
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
    }
}
