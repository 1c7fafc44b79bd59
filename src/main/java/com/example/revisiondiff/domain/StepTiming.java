package com.example.revisiondiff.domain;

/**
 * Elapsed wall time of one named step of a comparison.
 */
public record StepTiming(String label, double durationSeconds) {
    public static StepTiming since(String label, long startNanos) {
        return new StepTiming(label, (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }
}
