package com.example.revisiondiff.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Outcome of one comparison: the aligned segments and the three views derived from them.
 * Computed on demand and never persisted.
 */
@Getter
@NoArgsConstructor
public class DiffResult {
    static final int PREVIEW_LENGTH = 50;

    @JsonProperty("version_a_preview")
    private String versionAPreview;

    @JsonProperty("version_b_preview")
    private String versionBPreview;

    private List<DiffSegment> segments;
    private double similarity;

    @JsonProperty("html_diff")
    private String htmlDiff;

    private DiffSummary summary;

    @Setter
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ComparisonTiming timing;

    public DiffResult(
            String textA,
            String textB,
            List<DiffSegment> segments,
            double similarity,
            String htmlDiff,
            DiffSummary summary) {
        this.versionAPreview = preview(textA);
        this.versionBPreview = preview(textB);
        this.segments = List.copyOf(segments);
        this.similarity = similarity;
        this.htmlDiff = htmlDiff;
        this.summary = summary;
        this.timing = null;
    }

    static String preview(String text) {
        if (text.codePointCount(0, text.length()) <= PREVIEW_LENGTH) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, PREVIEW_LENGTH)) + "...";
    }
}
