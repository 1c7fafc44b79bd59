package com.example.revisiondiff.domain;

/**
 * {@code a[a .. a + size)} equals {@code b[b .. b + size)}.
 */
public record MatchingBlock(int a, int b, int size) {}
