package com.example.revisiondiff.domain;

/**
 * Base of every failure this engine reports to its callers.
 */
public abstract class RevisionException extends RuntimeException {
    private final ErrorCode code;

    protected RevisionException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected RevisionException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
