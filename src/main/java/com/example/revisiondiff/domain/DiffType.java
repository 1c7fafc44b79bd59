package com.example.revisiondiff.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classification of one aligned run between an original and a modified text.
 */
public enum DiffType {
    EQUAL,
    INSERT,
    DELETE,
    REPLACE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
