package com.knowledgecore.vector;

/**
 * The vector store could not be reached or answered with a transient error (5xx, 429). Safe to retry.
 */
public class StoreUnreachableException extends VectorStoreException {

    public StoreUnreachableException(String message, Throwable cause) {
        super(message, -1, cause);
    }

    public StoreUnreachableException(String message, int statusCode) {
        super(message, statusCode, null);
    }
}
