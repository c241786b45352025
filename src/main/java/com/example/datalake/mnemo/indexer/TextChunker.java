package com.example.datalake.mnemo.indexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into overlapping windows, preferring to cut at a paragraph, line, sentence or
 * word boundary in the second half of each window.
 */
public class TextChunker {

    private static final String[] SEPARATORS = {"\n\n", "\n", ". ", " "};

    private final int chunkChars;
    private final int overlapChars;
    private final int minChunkChars;

    public TextChunker(int chunkChars, int overlapChars, int minChunkChars) {
        if (overlapChars * 2 >= chunkChars) {
            throw new IllegalArgumentException("overlap must be less than half the chunk size");
        }
        this.chunkChars = chunkChars;
        this.overlapChars = overlapChars;
        this.minChunkChars = minChunkChars;
    }

    public List<String> chunk(String text) {
        if (text == null) {
            return List.of();
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        if (trimmed.length() <= chunkChars) {
            return trimmed.length() >= minChunkChars ? List.of(trimmed) : List.of();
        }

        List<String> chunks = new ArrayList<>();
        int length = trimmed.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + chunkChars, length);
            if (end < length) {
                end = naturalBreak(trimmed, start, end);
            }

            String chunk = trimmed.substring(start, end).strip();
            if (chunk.length() >= minChunkChars) {
                chunks.add(chunk);
            }

            start = end < length ? end - overlapChars : length;
        }
        return chunks;
    }

    /**
     * End of the window moved back to just after the highest-priority separator found past
     * the window's midpoint, or {@code end} unchanged.
     */
    private int naturalBreak(String text, int start, int end) {
        int midpoint = start + chunkChars / 2;
        for (String sep : SEPARATORS) {
            int pos = text.lastIndexOf(sep, end - sep.length());
            if (pos > midpoint) {
                return pos + sep.length();
            }
        }
        return end;
    }
}
