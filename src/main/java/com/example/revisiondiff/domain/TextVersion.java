package com.example.revisiondiff.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable snapshot of a document's full content. {@code label} and {@code style} are free-form
 * annotations and may be {@code null}.
 */
public record TextVersion(
        @JsonProperty("version_id") String versionId,
        @JsonProperty("content") String content,
        @JsonProperty("timestamp") LocalDateTime timestamp,
        @JsonProperty("label") String label,
        @JsonProperty("style") String style) {
    public TextVersion {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
