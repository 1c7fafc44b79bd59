package com.example.revisiondiff.application;

import com.example.revisiondiff.domain.DiffSegment;
import com.example.revisiondiff.domain.DiffSummary;
import com.example.revisiondiff.domain.Granularity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryAggregatorTest {

    private final SummaryAggregator aggregator = new SummaryAggregator();

    @Test
    void kittenToSittingCountsBothSidesOfReplacements() {
        List<DiffSegment> segments = new DiffEngine().compare("kitten", "sitting", Granularity.CHAR);

        assertThat(aggregator.summarize(segments)).isEqualTo(new DiffSummary(3, 2, 2, 4, 5));
    }

    @Test
    void emptySegmentsSummarizeToZero() {
        assertThat(aggregator.summarize(List.of())).isEqualTo(DiffSummary.EMPTY);
    }

    @Test
    void pureInsertionAndDeletionAreNotReplacements() {
        DiffSummary summary =
                aggregator.summarize(
                        List.of(
                                DiffSegment.equal("ab", 0, 2),
                                DiffSegment.delete("cd", 2, 4),
                                DiffSegment.insert("xyz", 4)));

        assertThat(summary.insertions()).isEqualTo(3);
        assertThat(summary.deletions()).isEqualTo(2);
        assertThat(summary.replacements()).isZero();
        assertThat(summary.unchangedChars()).isEqualTo(2);
        assertThat(summary.totalChanges()).isEqualTo(5);
    }

    @Test
    void charactersOutsideBasicPlaneCountOnce() {
        DiffSummary summary =
                aggregator.summarize(
                        List.of(
                                DiffSegment.equal("😀", 0, 1),
                                DiffSegment.replace("😀", "😃!", 1, 2)));

        assertThat(summary).isEqualTo(new DiffSummary(2, 1, 1, 1, 3));
    }
}
