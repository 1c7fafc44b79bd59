package com.example.revisiondiff.application;

import com.example.revisiondiff.domain.Alignment;
import com.example.revisiondiff.domain.ComparisonRequest;
import com.example.revisiondiff.domain.ComparisonTiming;
import com.example.revisiondiff.domain.DiffResult;
import com.example.revisiondiff.domain.DiffSummary;
import com.example.revisiondiff.domain.Granularity;
import com.example.revisiondiff.domain.StepTiming;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares two raw texts: align once, then derive markup, change counts and similarity from the
 * same alignment. Holds no mutable state, so concurrent comparisons are independent.
 */
@Service
public class TextComparisonUseCase {
    private static final Logger log = LogManager.getLogger(TextComparisonUseCase.class);

    static final String STEP_ALIGN = "Align texts";
    static final String STEP_SIMILARITY = "Score similarity";
    static final String STEP_RENDER = "Render markup";
    static final String STEP_SUMMARIZE = "Summarize changes";

    private final DiffEngine diffEngine;
    private final SimilarityScorer similarityScorer;
    private final DiffRenderer diffRenderer;
    private final SummaryAggregator summaryAggregator;
    private final PatchRenderer patchRenderer;

    public TextComparisonUseCase(
            DiffEngine diffEngine,
            SimilarityScorer similarityScorer,
            DiffRenderer diffRenderer,
            SummaryAggregator summaryAggregator,
            PatchRenderer patchRenderer) {
        this.diffEngine = diffEngine;
        this.similarityScorer = similarityScorer;
        this.diffRenderer = diffRenderer;
        this.summaryAggregator = summaryAggregator;
        this.patchRenderer = patchRenderer;
    }

    public DiffResult compare(String textA, String textB, boolean charLevel) {
        return compare(ComparisonRequest.of(textA, textB, charLevel));
    }

    public DiffResult compare(ComparisonRequest request) {
        List<StepTiming> timings = new ArrayList<>();
        long overallStart = System.nanoTime();

        long alignStart = System.nanoTime();
        Alignment alignment =
                diffEngine.align(request.textA(), request.textB(), request.granularity());
        timings.add(StepTiming.since(STEP_ALIGN, alignStart));

        long similarityStart = System.nanoTime();
        double similarity = similarityScorer.similarity(alignment);
        timings.add(StepTiming.since(STEP_SIMILARITY, similarityStart));

        long renderStart = System.nanoTime();
        String html = diffRenderer.render(alignment.segments());
        timings.add(StepTiming.since(STEP_RENDER, renderStart));

        long summaryStart = System.nanoTime();
        DiffSummary summary = summaryAggregator.summarize(alignment.segments());
        timings.add(StepTiming.since(STEP_SUMMARIZE, summaryStart));

        DiffResult result =
                new DiffResult(
                        request.textA(),
                        request.textB(),
                        alignment.segments(),
                        similarity,
                        html,
                        summary);
        double totalSeconds = (System.nanoTime() - overallStart) / 1_000_000_000.0;
        result.setTiming(new ComparisonTiming(timings, totalSeconds));
        log.info(
                "Compared {} vs {} units at {} granularity in {}s: {} segments, similarity {}",
                alignment.unitsA(),
                alignment.unitsB(),
                alignment.granularity(),
                totalSeconds,
                alignment.segments().size(),
                similarity);
        return result;
    }

    /**
     * Unified diff of the two texts, line by line, with {@code contextSize} unchanged lines
     * around each hunk.
     */
    public String unifiedDiff(String name, String textA, String textB, int contextSize) {
        ComparisonRequest request = new ComparisonRequest(textA, textB, Granularity.LINE);
        diffEngine.checkLength("Original text", request.textA());
        diffEngine.checkLength("Modified text", request.textB());
        return patchRenderer.render(name, request.textA(), request.textB(), contextSize);
    }
}
