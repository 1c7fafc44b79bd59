package com.example.revisiondiff.domain;

/**
 * Comparison input is longer than the configured cap.
 */
public class ResourceLimitExceededException extends RevisionException {
    private final int length;
    private final int limit;

    public ResourceLimitExceededException(String input, int length, int limit) {
        super(
                ErrorCode.RESOURCE_LIMIT_EXCEEDED,
                String.format(
                        "%s is %d characters long; comparisons are limited to %d", input, length, limit));
        this.length = length;
        this.limit = limit;
    }

    public int getLength() {
        return length;
    }

    public int getLimit() {
        return limit;
    }
}
