package com.knowledgecore.vector;

public class VectorStoreException extends RuntimeException {
    private final int statusCode;

    public VectorStoreException(String message) {
        this(message, -1, null);
    }

    public VectorStoreException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public VectorStoreException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status reported by the store, or -1 when the request never got a response. */
    public int statusCode() {
        return statusCode;
    }
}
