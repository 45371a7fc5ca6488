package com.knowledgecore.ingest;

import java.util.List;

import com.knowledgecore.registry.RegistryDrift;

/**
 * Result of comparing (and optionally repairing) the registry against the vector store.
 *
 * @param documentsFound distinct registrable sources in the vector store
 * @param repaired       drifts fixed in the registry
 * @param failed         drifts whose repair failed
 */
public record ReconciliationReport(int documentsFound, List<RegistryDrift> drifts, int repaired, int failed) {

    public ReconciliationReport {
        drifts = List.copyOf(drifts);
    }

    public boolean consistent() {
        return drifts.isEmpty();
    }
}
