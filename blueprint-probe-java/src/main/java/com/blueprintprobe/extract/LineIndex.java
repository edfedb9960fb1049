package com.blueprintprobe.extract;

import com.blueprintprobe.graph.StubModel.LineRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps character offsets of one document to 1-indexed line numbers.
 * Line of an offset = number of newlines strictly before it, plus one.
 */
public class LineIndex {

    private final int[] newlineOffsets;

    public LineIndex(String text) {
        List<Integer> offsets = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') offsets.add(i);
        }
        this.newlineOffsets = offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(newlineOffsets, offset);
        // Exact hit: the newline at `offset` is not before it.
        int before = idx >= 0 ? idx : -idx - 1;
        return before + 1;
    }

    /**
     * Line range of the half-open span {@code [start, end)}; the last line is the line of
     * the span's final character.
     */
    public LineRange range(int start, int end) {
        return new LineRange(lineOf(start), lineOf(Math.max(start, end - 1)));
    }
}
