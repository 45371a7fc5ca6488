package com.knowledgecore.embedding;

public class ModelUnavailableException extends RuntimeException {
    private final int attempts;

    public ModelUnavailableException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
