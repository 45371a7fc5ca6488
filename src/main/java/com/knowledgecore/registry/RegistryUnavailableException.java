package com.knowledgecore.registry;

public class RegistryUnavailableException extends RuntimeException {
    private final int statusCode;

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public RegistryUnavailableException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
