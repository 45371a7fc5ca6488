package com.knowledgecore.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record KnowledgeMetadata(
        String source,
        String filename,
        DocumentType type,
        int chunkIndex,
        int totalChunks,
        String dateAdded,
        Map<String, Object> extras) {

    public KnowledgeMetadata {
        source = source == null ? "" : source;
        filename = filename == null ? "" : filename;
        type = type == null ? DocumentType.TEXT : type;
        dateAdded = dateAdded == null ? "" : dateAdded;
        extras = copyWithoutNulls(extras);
    }

    public static KnowledgeMetadata forChunk(
            String source,
            String filename,
            DocumentType type,
            int chunkIndex,
            int totalChunks,
            String dateAdded) {
        if (chunkIndex < 0 || chunkIndex >= totalChunks) {
            throw new IllegalArgumentException("chunkIndex " + chunkIndex + " out of range for totalChunks " + totalChunks);
        }
        return new KnowledgeMetadata(source, filename, type, chunkIndex, totalChunks, dateAdded, Map.of());
    }

    public KnowledgeMetadata withExtras(Map<String, Object> additional) {
        Map<String, Object> merged = new LinkedHashMap<>(extras);
        merged.putAll(copyWithoutNulls(additional));
        return new KnowledgeMetadata(source, filename, type, chunkIndex, totalChunks, dateAdded, merged);
    }

    private static Map<String, Object> copyWithoutNulls(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
