package com.knowledgecore.ingest;

/**
 * A slice of normalized document text. Offsets point into the normalized text the chunk was cut from;
 * {@code text} is that slice with surrounding whitespace trimmed.
 */
public record Chunk(String text, int index, int startOffset, int endOffset) {
}
