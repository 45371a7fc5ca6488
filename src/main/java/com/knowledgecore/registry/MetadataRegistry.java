package com.knowledgecore.registry;

import java.util.List;

import com.knowledgecore.ingest.DocumentType;

/**
 * Document-level listing kept beside the vector store. Rows are keyed by {@code source}. The vector store
 * stays authoritative; this registry can always be rebuilt from it.
 *
 * <p>Every operation throws {@link RegistryUnavailableException} when the backing store cannot be reached.
 */
public interface MetadataRegistry {

    /** Inserts the row, or updates it when {@code source} is already registered. */
    void register(String source, String title, DocumentType type, int chunkCount);

    /** Removes the row for {@code source}. Removing an unknown source is not an error. */
    void unregister(String source);

    /** All rows, newest first. */
    List<KnowledgeDocument> list();

    void updateChunkCount(String source, int chunkCount);

    /** Verifies the backing table exists and is readable. */
    void testTable();

    /** Deletes every row. Only meant for a full reset ahead of a migration. */
    void clearAll();
}
