package com.example.revisiondiff.application;

import com.example.revisiondiff.domain.Granularity;
import com.example.revisiondiff.domain.ResourceLimitExceededException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SimilarityScorerTest {

    private final SimilarityScorer scorer = new SimilarityScorer(new DiffEngine());

    @Test
    void kittenAndSittingScoreFromSharedRuns() {
        assertEquals(0.6154, scorer.similarity("kitten", "sitting", Granularity.CHAR));
    }

    @Test
    void emptyTextsAreIdentical() {
        assertEquals(1.0, scorer.similarity("", "", Granularity.CHAR));
        assertEquals(1.0, scorer.similarity("", "", Granularity.LINE));
    }

    @Test
    void oneEmptyTextScoresZero() {
        assertEquals(0.0, scorer.similarity("", "abc", Granularity.CHAR));
        assertEquals(0.0, scorer.similarity("abc", "", Granularity.LINE));
    }

    @Test
    void textIsFullySimilarToItself() {
        String text = "A paragraph with some punctuation, and a second clause.";

        assertEquals(1.0, scorer.similarity(text, text, Granularity.CHAR));
        assertEquals(1.0, scorer.similarity(text, text, Granularity.LINE));
    }

    @Test
    void disjointTextsScoreZero() {
        assertEquals(0.0, scorer.similarity("abc", "xyz", Granularity.CHAR));
    }

    @Test
    void lineGranularityCountsWholeLines() {
        assertEquals(0.5, scorer.similarity("a\nb\n", "a\nc\n", Granularity.LINE));
        assertEquals(0.75, scorer.similarity("a\nb\n", "a\nc\n", Granularity.CHAR));
    }

    @Test
    void scoreStaysWithinUnitInterval() {
        double score = scorer.similarity("The quick brown fox.", "A quick brown dog jumps.", Granularity.CHAR);

        assertThat(score).isBetween(0.0, 1.0);
    }

    @Test
    void scoringRespectsEngineInputLimit() {
        SimilarityScorer capped = new SimilarityScorer(new DiffEngine(3));

        assertThatThrownBy(() -> capped.similarity("abcd", "abc", Granularity.CHAR))
                .isInstanceOf(ResourceLimitExceededException.class);
    }

    @Test
    void roundingKeepsFourDecimals() {
        assertEquals(0.6667, SimilarityScorer.round(2.0 / 3.0));
        assertEquals(0.3333, SimilarityScorer.round(1.0 / 3.0));
        assertEquals(1.0, SimilarityScorer.round(1.0));
    }
}
