package com.example.revisiondiff.application;

import com.example.revisiondiff.domain.Alignment;
import com.example.revisiondiff.domain.DiffSegment;
import com.example.revisiondiff.domain.DiffType;
import com.example.revisiondiff.domain.Granularity;
import com.example.revisiondiff.domain.Opcode;
import com.example.revisiondiff.domain.ResourceLimitExceededException;
import com.example.revisiondiff.domain.SequenceMatcher;
import com.example.revisiondiff.domain.TextUnits;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Aligns two texts into ordered, contiguous segments. Concatenating {@code original} over the
 * result yields the first text and concatenating {@code modified} yields the second.
 *
 * <p>Inputs longer than {@code revision.compare.max-input-length} characters are rejected with
 * {@link ResourceLimitExceededException} before any alignment work.
 */
@Service
public class DiffEngine {
    static final int DEFAULT_MAX_INPUT_LENGTH = 20_000;

    private final int maxInputLength;

    public DiffEngine() {
        this(DEFAULT_MAX_INPUT_LENGTH);
    }

    @Autowired
    public DiffEngine(@Value("${revision.compare.max-input-length:20000}") int maxInputLength) {
        this.maxInputLength = maxInputLength;
    }

    public List<DiffSegment> compare(String textA, String textB, Granularity granularity) {
        return align(textA, textB, granularity).segments();
    }

    public Alignment align(String textA, String textB, Granularity granularity) {
        checkLength("Original text", textA);
        checkLength("Modified text", textB);
        return switch (granularity) {
            case CHAR -> alignCharacters(textA, textB);
            case LINE -> alignLines(textA, textB);
        };
    }

    private Alignment alignCharacters(String textA, String textB) {
        int[] unitsA = textA.codePoints().toArray();
        int[] unitsB = textB.codePoints().toArray();
        SequenceMatcher matcher = new SequenceMatcher(unitsA, unitsB);

        List<DiffSegment> segments = new ArrayList<>();
        for (Opcode opcode : matcher.getOpcodes()) {
            String original = new String(unitsA, opcode.i1(), opcode.originalLength());
            String modified = new String(unitsB, opcode.j1(), opcode.modifiedLength());
            segments.add(toSegment(opcode.type(), original, modified, opcode.i1(), opcode.i2()));
        }
        return new Alignment(
                Granularity.CHAR, segments, matcher.matchedUnits(), unitsA.length, unitsB.length);
    }

    private Alignment alignLines(String textA, String textB) {
        List<String> linesA = TextUnits.splitLines(textA);
        List<String> linesB = TextUnits.splitLines(textB);
        SequenceMatcher matcher = SequenceMatcher.of(linesA, linesB);

        // offsets[i] = code points preceding line i of A
        int[] offsets = new int[linesA.size() + 1];
        for (int i = 0; i < linesA.size(); i++) {
            offsets[i + 1] = offsets[i] + TextUnits.length(linesA.get(i));
        }

        List<DiffSegment> segments = new ArrayList<>();
        for (Opcode opcode : matcher.getOpcodes()) {
            String original = String.join("", linesA.subList(opcode.i1(), opcode.i2()));
            String modified = String.join("", linesB.subList(opcode.j1(), opcode.j2()));
            segments.add(
                    toSegment(
                            opcode.type(),
                            original,
                            modified,
                            offsets[opcode.i1()],
                            offsets[opcode.i2()]));
        }
        return new Alignment(
                Granularity.LINE, segments, matcher.matchedUnits(), linesA.size(), linesB.size());
    }

    /**
     * Rejects {@code text} when it has more characters than this engine aligns.
     */
    public void checkLength(String input, String text) {
        if (text.length() <= maxInputLength) {
            return;
        }
        int length = TextUnits.length(text);
        if (length > maxInputLength) {
            throw new ResourceLimitExceededException(input, length, maxInputLength);
        }
    }

    private DiffSegment toSegment(
            DiffType type, String original, String modified, int startPos, int endPos) {
        return switch (type) {
            case EQUAL -> DiffSegment.equal(original, startPos, endPos);
            case INSERT -> DiffSegment.insert(modified, startPos);
            case DELETE -> DiffSegment.delete(original, startPos, endPos);
            case REPLACE -> DiffSegment.replace(original, modified, startPos, endPos);
        };
    }
}
