package com.knowledgecore.vector;

import java.util.List;

import com.knowledgecore.ingest.KnowledgeItem;

/**
 * Operations against an external vector database holding chunk text, metadata and embeddings.
 *
 * <p>{@link #deleteBySource}, {@link #findIdsBySource} and {@link #listItems} walk the entire collection
 * page by page. Their cost grows with collection size, so they belong to background and maintenance paths,
 * never to per-query code.
 */
public interface VectorStore {

    /** Creates the collection when absent; verifies its vector size when present. Idempotent. */
    void ensureCollection(String collection);

    void upsert(String collection, List<KnowledgeItem> items);

    List<SearchResult> search(String collection, float[] queryVector, int limit);

    void deleteVectors(String collection, List<String> ids);

    List<String> findIdsBySource(String collection, String source, CancellationToken token);

    /**
     * Full scan of the collection, local filter on exact {@code source} match, then batched deletes.
     *
     * @return number of points deleted
     */
    int deleteBySource(String collection, String source, CancellationToken token);

    List<KnowledgeItem> listItems(String collection, CancellationToken token);

    int vectorSize();

    default int deleteBySource(String collection, String source) {
        return deleteBySource(collection, source, CancellationToken.none());
    }

    default List<KnowledgeItem> listItems(String collection) {
        return listItems(collection, CancellationToken.none());
    }
}
