package com.example.revisiondiff.infrastructure;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.DeltaType;
import com.github.difflib.patch.Patch;
import com.github.difflib.patch.PatchFailedException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RatcliffObershelpAlgorithmTest {

    @Test
    void patchBuiltFromMatcherReproducesRevisedLines() throws PatchFailedException {
        List<String> original = List.of("one", "two", "three");
        List<String> revised = List.of("one", "2", "three", "four");

        Patch<String> patch =
                DiffUtils.diff(original, revised, new RatcliffObershelpAlgorithm<>(), null);

        assertThat(patch.getDeltas())
                .extracting(AbstractDelta::getType)
                .containsExactly(DeltaType.CHANGE, DeltaType.INSERT);
        assertThat(DiffUtils.patch(original, patch)).isEqualTo(revised);
    }

    @Test
    void identicalListsProduceNoDeltas() {
        List<String> lines = List.of("same", "lines");

        Patch<String> patch = DiffUtils.diff(lines, lines, new RatcliffObershelpAlgorithm<>(), null);

        assertThat(patch.getDeltas()).isEmpty();
    }

    @Test
    void removedLinesBecomeDeleteDeltas() throws PatchFailedException {
        List<String> original = List.of("keep", "drop", "keep too");
        List<String> revised = List.of("keep", "keep too");

        Patch<String> patch =
                DiffUtils.diff(original, revised, new RatcliffObershelpAlgorithm<>(), null);

        assertThat(patch.getDeltas()).singleElement().extracting(AbstractDelta::getType).isEqualTo(DeltaType.DELETE);
        assertThat(DiffUtils.patch(original, patch)).isEqualTo(revised);
    }
}
