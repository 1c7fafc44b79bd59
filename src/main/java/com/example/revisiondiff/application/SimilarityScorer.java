package com.example.revisiondiff.application;

import com.example.revisiondiff.domain.Alignment;
import com.example.revisiondiff.domain.Granularity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Similarity ratio {@code 2 * M / T} over the units of an alignment, rounded to four decimals.
 */
@Component
public class SimilarityScorer {
    private static final int PRECISION = 4;

    private final DiffEngine diffEngine;

    public SimilarityScorer(DiffEngine diffEngine) {
        this.diffEngine = diffEngine;
    }

    public double similarity(String textA, String textB, Granularity granularity) {
        if (textA.isEmpty() || textB.isEmpty()) {
            return textA.isEmpty() && textB.isEmpty() ? 1.0 : 0.0;
        }
        return similarity(diffEngine.align(textA, textB, granularity));
    }

    public double similarity(Alignment alignment) {
        int total = alignment.unitsA() + alignment.unitsB();
        if (alignment.unitsA() == 0 || alignment.unitsB() == 0) {
            return total == 0 ? 1.0 : 0.0;
        }
        return round(2.0 * alignment.matchedUnits() / total);
    }

    static double round(double ratio) {
        return new BigDecimal(ratio).setScale(PRECISION, RoundingMode.HALF_EVEN).doubleValue();
    }
}
