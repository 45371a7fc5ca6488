package com.knowledgecore.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits document text into overlapping chunks sized for the embedding model (roughly 4 characters per
 * token). Cuts prefer a paragraph break, then a sentence end, then a line break, as long as the break lies
 * past the middle of the current window.
 */
public class Chunker {
    public static final int DEFAULT_CHUNK_SIZE = 2000;
    public static final int DEFAULT_OVERLAP = 200;
    public static final int DEFAULT_MIN_CHUNK_SIZE = 50;

    private static final List<String> SENTENCE_ENDINGS = List.of(". ", ".\n", "! ", "!\n", "? ", "?\n");

    private final int chunkSize;
    private final int overlap;
    private final int minChunkSize;

    public Chunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP, DEFAULT_MIN_CHUNK_SIZE);
    }

    public Chunker(int chunkSize, int overlap, int minChunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, chunkSize)");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.minChunkSize = Math.max(0, minChunkSize);
    }

    public List<Chunk> chunk(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        if (normalized.length() <= chunkSize) {
            return List.of(new Chunk(normalized, 0, 0, normalized.length()));
        }

        List<Chunk> chunks = new ArrayList<>();
        int length = normalized.length();
        int start = 0;
        int index = 0;
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length) {
                int breakPoint = findBreakPoint(normalized, start, end);
                if (breakPoint > start) {
                    end = breakPoint;
                }
            }

            String slice = normalized.substring(start, end).trim();
            if (slice.length() >= minChunkSize) {
                chunks.add(new Chunk(slice, index++, start, end));
            }
            if (end >= length) {
                break;
            }

            int next = end - overlap;
            start = next > start ? next : end;
        }
        return chunks;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n").replace('\r', '\n').strip();
    }

    private int findBreakPoint(String text, int start, int end) {
        int threshold = start + chunkSize / 2;

        int paragraph = text.lastIndexOf("\n\n", end - 2);
        if (paragraph > threshold) {
            return paragraph + 2;
        }

        int sentence = lastSentenceEnd(text, threshold, end);
        if (sentence > 0) {
            return sentence;
        }

        int line = text.lastIndexOf('\n', end - 1);
        if (line > threshold) {
            return line + 1;
        }
        return end;
    }

    private static int lastSentenceEnd(String text, int threshold, int end) {
        int best = -1;
        for (String ending : SENTENCE_ENDINGS) {
            int position = text.lastIndexOf(ending, end - ending.length());
            if (position > threshold) {
                best = Math.max(best, position + ending.length());
            }
        }
        return best;
    }
}
