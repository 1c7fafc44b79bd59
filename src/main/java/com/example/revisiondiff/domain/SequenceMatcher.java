package com.example.revisiondiff.domain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp alignment of two sequences of integer-coded units.
 *
 * <p>The longest contiguous matching block is found first, then the unmatched regions on either
 * side of it are aligned the same way. When several blocks share the maximal length the one that
 * starts earliest in {@code a} wins, and among those the one that starts earliest in {@code b}.
 *
 * <p>Instances are not thread-safe; create one per comparison. The input arrays must not be
 * modified while the matcher is in use.
 */
public final class SequenceMatcher {
    private final int[] a;
    private final int[] b;
    private final Map<Integer, int[]> positionsInB;

    // Run lengths of the previous and current row, indexed by (j + 1). Kept zeroed between calls.
    private final int[] runLengths;
    private final int[] nextRunLengths;
    private final int[] touched;
    private final int[] nextTouched;

    private List<MatchingBlock> matchingBlocks;
    private List<Opcode> opcodes;

    public SequenceMatcher(int[] a, int[] b) {
        this.a = a;
        this.b = b;
        this.positionsInB = indexPositions(b);
        this.runLengths = new int[b.length + 1];
        this.nextRunLengths = new int[b.length + 1];
        this.touched = new int[b.length];
        this.nextTouched = new int[b.length];
    }

    /**
     * Aligns two lists whose elements are compared with {@link Object#equals(Object)}.
     */
    public static <T> SequenceMatcher of(List<T> a, List<T> b) {
        Map<T, Integer> ids = new HashMap<>();
        return new SequenceMatcher(intern(a, ids), intern(b, ids));
    }

    /**
     * Longest block within {@code a[alo .. ahi)} and {@code b[blo .. bhi)}; a block of size 0
     * located at {@code (alo, blo)} when nothing matches.
     */
    public MatchingBlock findLongestMatch(int alo, int ahi, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;

        int[] previous = runLengths;
        int[] current = nextRunLengths;
        int[] previousTouched = touched;
        int[] currentTouched = nextTouched;
        int previousCount = 0;

        for (int i = alo; i < ahi; i++) {
            int currentCount = 0;
            int[] positions = positionsInB.get(a[i]);
            if (positions != null) {
                for (int j : positions) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = previous[j] + 1;
                    current[j + 1] = k;
                    currentTouched[currentCount++] = j + 1;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            for (int t = 0; t < previousCount; t++) {
                previous[previousTouched[t]] = 0;
            }
            int[] swap = previous;
            previous = current;
            current = swap;
            swap = previousTouched;
            previousTouched = currentTouched;
            currentTouched = swap;
            previousCount = currentCount;
        }
        for (int t = 0; t < previousCount; t++) {
            previous[previousTouched[t]] = 0;
        }
        return new MatchingBlock(bestI, bestJ, bestSize);
    }

    /**
     * Non-overlapping matching blocks in increasing order, adjacent blocks merged, terminated by
     * the sentinel {@code (a.length, b.length, 0)}.
     */
    public List<MatchingBlock> getMatchingBlocks() {
        if (matchingBlocks != null) {
            return matchingBlocks;
        }
        List<MatchingBlock> found = new ArrayList<>();
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[] {0, a.length, 0, b.length});
        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];
            MatchingBlock block = findLongestMatch(alo, ahi, blo, bhi);
            if (block.size() == 0) {
                continue;
            }
            found.add(block);
            if (alo < block.a() && blo < block.b()) {
                pending.push(new int[] {alo, block.a(), blo, block.b()});
            }
            int aEnd = block.a() + block.size();
            int bEnd = block.b() + block.size();
            if (aEnd < ahi && bEnd < bhi) {
                pending.push(new int[] {aEnd, ahi, bEnd, bhi});
            }
        }
        found.sort(Comparator.comparingInt(MatchingBlock::a).thenComparingInt(MatchingBlock::b));

        List<MatchingBlock> merged = new ArrayList<>();
        int i1 = 0;
        int j1 = 0;
        int k1 = 0;
        for (MatchingBlock block : found) {
            if (i1 + k1 == block.a() && j1 + k1 == block.b()) {
                k1 += block.size();
            } else {
                if (k1 > 0) {
                    merged.add(new MatchingBlock(i1, j1, k1));
                }
                i1 = block.a();
                j1 = block.b();
                k1 = block.size();
            }
        }
        if (k1 > 0) {
            merged.add(new MatchingBlock(i1, j1, k1));
        }
        merged.add(new MatchingBlock(a.length, b.length, 0));
        matchingBlocks = Collections.unmodifiableList(merged);
        return matchingBlocks;
    }

    /**
     * Ordered runs covering both sequences completely. Empty when both sequences are empty.
     */
    public List<Opcode> getOpcodes() {
        if (opcodes != null) {
            return opcodes;
        }
        List<Opcode> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        for (MatchingBlock block : getMatchingBlocks()) {
            DiffType type = null;
            if (i < block.a() && j < block.b()) {
                type = DiffType.REPLACE;
            } else if (i < block.a()) {
                type = DiffType.DELETE;
            } else if (j < block.b()) {
                type = DiffType.INSERT;
            }
            if (type != null) {
                result.add(new Opcode(type, i, block.a(), j, block.b()));
            }
            i = block.a() + block.size();
            j = block.b() + block.size();
            if (block.size() > 0) {
                result.add(new Opcode(DiffType.EQUAL, block.a(), i, block.b(), j));
            }
        }
        opcodes = Collections.unmodifiableList(result);
        return opcodes;
    }

    public int matchedUnits() {
        int matched = 0;
        for (MatchingBlock block : getMatchingBlocks()) {
            matched += block.size();
        }
        return matched;
    }

    /**
     * {@code 2 * M / T}; 1.0 when both sequences are empty.
     */
    double ratio() {
        int total = a.length + b.length;
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchedUnits() / total;
    }

    private static Map<Integer, int[]> indexPositions(int[] sequence) {
        Map<Integer, List<Integer>> positions = new HashMap<>();
        for (int j = 0; j < sequence.length; j++) {
            positions.computeIfAbsent(sequence[j], unit -> new ArrayList<>()).add(j);
        }
        Map<Integer, int[]> index = new HashMap<>(positions.size() * 2);
        positions.forEach(
                (unit, list) -> index.put(unit, list.stream().mapToInt(Integer::intValue).toArray()));
        return index;
    }

    private static <T> int[] intern(List<T> items, Map<T, Integer> ids) {
        int[] coded = new int[items.size()];
        for (int i = 0; i < coded.length; i++) {
            Integer id = ids.get(items.get(i));
            if (id == null) {
                id = ids.size();
                ids.put(items.get(i), id);
            }
            coded[i] = id;
        }
        return coded;
    }
}
