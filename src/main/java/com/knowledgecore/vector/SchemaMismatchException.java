package com.knowledgecore.vector;

/**
 * Vector dimensionality disagrees with the collection schema. This is a configuration bug and is never
 * retried.
 */
public class SchemaMismatchException extends VectorStoreException {
    private final int expected;
    private final int actual;

    public SchemaMismatchException(String message, int expected, int actual) {
        super(message + " (expected=" + expected + ", actual=" + actual + ")");
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
