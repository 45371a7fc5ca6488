package com.knowledgecore.ingest;

import java.util.Locale;

/**
 * Outcome of adding one document. When the vectors were written but the registry row could not be saved,
 * the ingestion still succeeds with {@code failure == REGISTRY_UNAVAILABLE}; reconciliation restores the
 * listing later.
 */
public record IngestionResult(
        String source,
        boolean success,
        int chunksIngested,
        int chunksReplaced,
        boolean registered,
        FailureCategory failure,
        String error) {

    static IngestionResult ingested(String source, int chunks, int replaced, boolean registered, String registryError) {
        return new IngestionResult(source, true, chunks, replaced, registered,
                registryError == null ? null : FailureCategory.REGISTRY_UNAVAILABLE, registryError);
    }

    static IngestionResult failed(String source, FailureCategory failure, String error) {
        return new IngestionResult(source, false, 0, 0, false, failure, error);
    }

    /** Message for end users; names the failure category, never the transport error. */
    public String describe() {
        if (!success) {
            return "Document not added (" + failure.name().toLowerCase(Locale.ROOT).replace('_', ' ') + ")";
        }
        if (failure == FailureCategory.REGISTRY_UNAVAILABLE) {
            return "Added " + chunksIngested + " chunks (listing pending reconciliation)";
        }
        return "Added " + chunksIngested + " chunks";
    }
}
