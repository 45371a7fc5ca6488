package com.knowledgecore.ingest;

/**
 * A chunk as stored in the vector store. {@code vector} is only populated on the write path; items read
 * back from listings or searches carry {@code null}.
 */
public record KnowledgeItem(String id, String content, KnowledgeMetadata metadata, float[] vector) {

    public KnowledgeItem withoutVector() {
        return new KnowledgeItem(id, content, metadata, null);
    }
}
