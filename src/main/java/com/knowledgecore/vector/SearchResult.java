package com.knowledgecore.vector;

import com.knowledgecore.ingest.KnowledgeMetadata;

/**
 * A ranked hit. {@code score} is the store's cosine similarity.
 */
public record SearchResult(String id, String content, KnowledgeMetadata metadata, double score) {

    public String source() {
        return metadata.source();
    }

    public String citation() {
        String snippet = content.strip().replaceAll("\\s+", " ");
        if (snippet.length() > 240) {
            snippet = snippet.substring(0, 240) + "...";
        }
        return "%s [%s] chunk %d/%d: %s".formatted(
                metadata.filename().isBlank() ? metadata.source() : metadata.filename(),
                metadata.source(),
                metadata.chunkIndex() + 1,
                metadata.totalChunks(),
                snippet);
    }
}
