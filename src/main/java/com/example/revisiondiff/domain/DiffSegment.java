package com.example.revisiondiff.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One contiguous run of an alignment. {@code startPos} and {@code endPos} are code point offsets
 * into the original text; an insertion is a zero-width range at the point where it occurs.
 */
public record DiffSegment(DiffType type, String original, String modified, int startPos, int endPos) {
    public DiffSegment {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(modified, "modified");
    }

    public static DiffSegment equal(String text, int startPos, int endPos) {
        return new DiffSegment(DiffType.EQUAL, text, text, startPos, endPos);
    }

    public static DiffSegment insert(String modified, int position) {
        return new DiffSegment(DiffType.INSERT, "", modified, position, position);
    }

    public static DiffSegment delete(String original, int startPos, int endPos) {
        return new DiffSegment(DiffType.DELETE, original, "", startPos, endPos);
    }

    public static DiffSegment replace(String original, String modified, int startPos, int endPos) {
        return new DiffSegment(DiffType.REPLACE, original, modified, startPos, endPos);
    }

    @JsonProperty("position")
    public Position position() {
        return new Position(startPos, endPos);
    }

    @JsonIgnore
    @Override
    public int startPos() {
        return startPos;
    }

    @JsonIgnore
    @Override
    public int endPos() {
        return endPos;
    }

    public record Position(int start, int end) {}
}
