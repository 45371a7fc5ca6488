package com.knowledgecore.registry;

import java.time.OffsetDateTime;

import com.knowledgecore.ingest.DocumentType;

/**
 * One registry row per source. {@code id} is {@code null} for documents derived from the vector store
 * rather than read from the registry.
 */
public record KnowledgeDocument(
        String id,
        String source,
        String title,
        DocumentType type,
        int chunkCount,
        OffsetDateTime dateAdded,
        OffsetDateTime updatedAt) {
}
