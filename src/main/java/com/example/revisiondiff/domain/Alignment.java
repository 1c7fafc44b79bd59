package com.example.revisiondiff.domain;

import java.util.List;

/**
 * Segments of one alignment together with the unit counts similarity is derived from.
 */
public record Alignment(
        Granularity granularity, List<DiffSegment> segments, int matchedUnits, int unitsA, int unitsB) {
    public Alignment {
        segments = List.copyOf(segments);
    }
}
