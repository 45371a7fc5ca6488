package com.knowledgecore.embedding;

/**
 * Acquires an embedding model, possibly downloading or unpacking it. May be slow and may fail transiently.
 */
@FunctionalInterface
public interface ModelLoader {
    EmbeddingService load() throws Exception;
}
