package com.example.revisiondiff.domain;

/**
 * Classified run turning {@code a[i1 .. i2)} into {@code b[j1 .. j2)}.
 */
public record Opcode(DiffType type, int i1, int i2, int j1, int j2) {
    public int originalLength() {
        return i2 - i1;
    }

    public int modifiedLength() {
        return j2 - j1;
    }
}
