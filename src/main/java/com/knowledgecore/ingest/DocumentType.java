package com.knowledgecore.ingest;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentType {
    TEXT("txt", true),
    MARKDOWN("md", true),
    PDF("pdf", true),
    URL("url", true),
    NOTION("notion", true),
    MEMORY("memory", false);

    private final String code;
    private final boolean registrable;

    DocumentType(String code, boolean registrable) {
        this.code = code;
        this.registrable = registrable;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Whether documents of this type get a row in the document registry. Memory entries live only in the
     * vector store.
     */
    public boolean registrable() {
        return registrable;
    }

    /**
     * Resolves a wire code. Unknown or missing codes map to {@link #TEXT} so legacy points without a type
     * still load.
     */
    @JsonCreator
    public static DocumentType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return TEXT;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (DocumentType type : values()) {
            if (type.code.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        return TEXT;
    }
}
