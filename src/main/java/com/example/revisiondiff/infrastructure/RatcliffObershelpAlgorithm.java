package com.example.revisiondiff.infrastructure;

import com.example.revisiondiff.domain.Opcode;
import com.example.revisiondiff.domain.SequenceMatcher;
import com.github.difflib.algorithm.Change;
import com.github.difflib.algorithm.DiffAlgorithmI;
import com.github.difflib.algorithm.DiffAlgorithmListener;
import com.github.difflib.patch.DeltaType;

import java.util.ArrayList;
import java.util.List;

/**
 * Plugs {@link SequenceMatcher} into java-diff-utils so that patches and unified diffs share the
 * block boundaries of the HTML comparison.
 */
public class RatcliffObershelpAlgorithm<T> implements DiffAlgorithmI<T> {

    @Override
    public List<Change> computeDiff(List<T> source, List<T> target, DiffAlgorithmListener progress) {
        if (progress != null) {
            progress.diffStart();
        }
        SequenceMatcher matcher = SequenceMatcher.of(source, target);
        List<Opcode> opcodes = matcher.getOpcodes();
        List<Change> changes = new ArrayList<>();
        for (int step = 0; step < opcodes.size(); step++) {
            Opcode opcode = opcodes.get(step);
            DeltaType deltaType =
                    switch (opcode.type()) {
                        case EQUAL -> null;
                        case INSERT -> DeltaType.INSERT;
                        case DELETE -> DeltaType.DELETE;
                        case REPLACE -> DeltaType.CHANGE;
                    };
            if (deltaType != null) {
                changes.add(new Change(deltaType, opcode.i1(), opcode.i2(), opcode.j1(), opcode.j2()));
            }
            if (progress != null) {
                progress.diffStep(step + 1, opcodes.size());
            }
        }
        if (progress != null) {
            progress.diffEnd();
        }
        return changes;
    }
}
