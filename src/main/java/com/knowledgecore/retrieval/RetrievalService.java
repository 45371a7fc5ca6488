package com.knowledgecore.retrieval;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgecore.embedding.EmbeddingGenerator;
import com.knowledgecore.vector.SearchResult;
import com.knowledgecore.vector.VectorStore;

/**
 * Semantic search over stored chunks. Results come back in the store's order, highest similarity first;
 * any minimum-score cut is left to the caller.
 */
public class RetrievalService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final EmbeddingGenerator embeddingGenerator;
    private final VectorStore vectorStore;
    private final String collection;
    private final int defaultLimit;

    public RetrievalService(EmbeddingGenerator embeddingGenerator, VectorStore vectorStore, String collection, int defaultLimit) {
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be positive");
        }
        this.embeddingGenerator = embeddingGenerator;
        this.vectorStore = vectorStore;
        this.collection = collection;
        this.defaultLimit = defaultLimit;
    }

    public List<SearchResult> query(String text) {
        return query(text, defaultLimit);
    }

    public List<SearchResult> query(String text, int limit) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        float[] queryVector = embeddingGenerator.embed(text);
        List<SearchResult> results = vectorStore.search(collection, queryVector, limit);
        log.debug("retrieval.query limit={} hits={} top={}", limit, results.size(),
                results.isEmpty() ? 0.0 : results.get(0).score());
        return results;
    }

    public int defaultLimit() {
        return defaultLimit;
    }
}
