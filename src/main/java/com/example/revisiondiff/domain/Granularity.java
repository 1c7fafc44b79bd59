package com.example.revisiondiff.domain;

/**
 * Atomic unit used when aligning two texts.
 */
public enum Granularity {
    CHAR,
    LINE;

    public static Granularity of(boolean charLevel) {
        return charLevel ? CHAR : LINE;
    }
}
