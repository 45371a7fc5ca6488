package com.knowledgecore.ingest;

public enum FailureCategory {
    INVALID_DOCUMENT,
    MODEL_UNAVAILABLE,
    STORE_UNREACHABLE,
    SCHEMA_MISMATCH,
    PARTIAL_DELETION,
    CANCELLED,
    REGISTRY_UNAVAILABLE
}
