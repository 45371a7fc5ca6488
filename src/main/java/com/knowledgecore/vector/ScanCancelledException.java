package com.knowledgecore.vector;

public class ScanCancelledException extends VectorStoreException {
    private final int pagesVisited;
    private final int deletedCount;
    private final int requestedCount;
    private final boolean timedOut;

    /**
     * @param requestedCount points matched by a completed scan, -1 when the stop came before the scan finished
     */
    public ScanCancelledException(String collection, int pagesVisited, int deletedCount, int requestedCount,
            boolean timedOut) {
        super((timedOut ? "Scan deadline exceeded" : "Scan cancelled") + " on " + collection
                + " after " + pagesVisited + " pages, " + deletedCount
                + (requestedCount < 0 ? "" : " of " + requestedCount) + " points deleted");
        this.pagesVisited = pagesVisited;
        this.deletedCount = deletedCount;
        this.requestedCount = requestedCount;
        this.timedOut = timedOut;
    }

    public int pagesVisited() {
        return pagesVisited;
    }

    public int deletedCount() {
        return deletedCount;
    }

    public int requestedCount() {
        return requestedCount;
    }

    public boolean timedOut() {
        return timedOut;
    }
}
