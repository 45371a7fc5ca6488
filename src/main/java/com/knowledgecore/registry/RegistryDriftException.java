package com.knowledgecore.registry;

import java.util.List;

public class RegistryDriftException extends RuntimeException {
    private final List<RegistryDrift> drifts;

    public RegistryDriftException(List<RegistryDrift> drifts) {
        super("Registry drifted from vector store for " + drifts.size() + " sources");
        this.drifts = List.copyOf(drifts);
    }

    public List<RegistryDrift> drifts() {
        return drifts;
    }
}
