package com.example.revisiondiff.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Change counts for one comparison. Character counts are code points; {@code replacements}
 * counts runs.
 */
public record DiffSummary(
        @JsonProperty("insertions") int insertions,
        @JsonProperty("deletions") int deletions,
        @JsonProperty("replacements") int replacements,
        @JsonProperty("unchanged_chars") int unchangedChars,
        @JsonProperty("total_changes") int totalChanges) {

    public static final DiffSummary EMPTY = new DiffSummary(0, 0, 0, 0, 0);
}
