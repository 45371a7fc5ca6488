package com.knowledgecore.registry;

/**
 * Disagreement between the registry and the vector store for one source.
 *
 * @param registeredCount chunk count stored in the registry, -1 when the source has no row
 * @param actualCount     points stored under the source in the vector store, 0 when none remain
 */
public record RegistryDrift(String source, Kind kind, int registeredCount, int actualCount) {

    public enum Kind {
        /** Vectors exist, no registry row. */
        MISSING_ROW,
        /** Row exists, its chunk count is wrong. */
        COUNT_MISMATCH,
        /** Row exists, no vectors remain. */
        ORPHAN_ROW
    }
}
