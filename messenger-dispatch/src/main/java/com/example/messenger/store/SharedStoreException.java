package com.example.messenger.store;

public class SharedStoreException extends RuntimeException {

    private final String operation;
    private final String key;

    public SharedStoreException(String operation, String key, Throwable cause) {
        super("Shared store %s failed for key %s".formatted(operation, key), cause);
        this.operation = operation;
        this.key = key;
    }

    public String getOperation() {
        return operation;
    }

    public String getKey() {
        return key;
    }
}
