package com.knowledgecore.vector;

public class PartialDeletionException extends VectorStoreException {
    private final int deletedCount;
    private final int requestedCount;

    public PartialDeletionException(String collection, int deletedCount, int requestedCount, Throwable cause) {
        super("Deleted " + deletedCount + " of " + requestedCount + " points from " + collection, cause);
        this.deletedCount = deletedCount;
        this.requestedCount = requestedCount;
    }

    public int deletedCount() {
        return deletedCount;
    }

    public int requestedCount() {
        return requestedCount;
    }
}
