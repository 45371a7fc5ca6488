package com.knowledgecore.ingest;

import java.time.Instant;

/**
 * A short fact remembered about the user, stored as a single point next to the documents so retrieval
 * can surface it.
 */
public record MemoryEntry(String id, String content, String category, double importance, String sourceType, Instant createdAt) {

    public String source() {
        return "memory:" + id;
    }
}
