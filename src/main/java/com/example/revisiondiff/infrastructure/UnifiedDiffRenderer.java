package com.example.revisiondiff.infrastructure;

import com.example.revisiondiff.application.PatchRenderer;
import com.example.revisiondiff.domain.TextUnits;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plain-text unified diff of two snapshots, line by line.
 */
@Component
public class UnifiedDiffRenderer implements PatchRenderer {
    static final String NO_TEXTUAL_DIFFERENCES_MESSAGE = "No textual differences available.";

    @Override
    public String render(String name, String original, String revised, int contextSize) {
        List<String> originalLines = TextUnits.splitLinesWithoutTerminators(original);
        List<String> revisedLines = TextUnits.splitLinesWithoutTerminators(revised);
        Patch<String> patch =
                DiffUtils.diff(originalLines, revisedLines, new RatcliffObershelpAlgorithm<>(), null);
        List<String> unified =
                UnifiedDiffUtils.generateUnifiedDiff(
                        name + "_orig", name + "_rev", originalLines, patch, Math.max(0, contextSize));
        if (patch.getDeltas().isEmpty()) {
            unified =
                    List.of(
                            String.format("--- %s_orig", name),
                            String.format("+++ %s_rev", name),
                            "@@ -0,0 +0,0 @@",
                            " " + NO_TEXTUAL_DIFFERENCES_MESSAGE);
        }
        return String.join(System.lineSeparator(), unified) + System.lineSeparator();
    }
}
