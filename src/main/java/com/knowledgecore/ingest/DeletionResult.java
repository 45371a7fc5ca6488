package com.knowledgecore.ingest;

/**
 * Outcome of removing one document.
 *
 * @param requestedCount points found for the source, -1 when the stop came before the scan finished
 */
public record DeletionResult(
        String source,
        boolean success,
        int deletedCount,
        int requestedCount,
        boolean unregistered,
        FailureCategory failure,
        String error) {

    public String describe() {
        if (success) {
            return "Removed " + deletedCount + " chunks";
        }
        if (requestedCount < 0) {
            return "Removed " + deletedCount + " chunks before the operation stopped";
        }
        return "Removed " + deletedCount + " of " + requestedCount + " chunks";
    }
}
