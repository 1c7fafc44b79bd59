package com.example.revisiondiff.domain;

import java.util.List;

/**
 * Step durations of one text comparison. Display only; never part of result equality.
 */
public record ComparisonTiming(List<StepTiming> steps, double totalDurationSeconds) {
    public ComparisonTiming {
        steps = List.copyOf(steps);
    }

    public double durationOf(String label) {
        return steps.stream()
                .filter(step -> step.label().equals(label))
                .mapToDouble(StepTiming::durationSeconds)
                .sum();
    }
}
