package com.knowledgecore.vector;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop signal for long pagination scans. Checked between pages and between delete batches, so a stop never
 * leaves a batch half applied.
 */
public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void requestStop() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared token cannot be cancelled");
        }
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
