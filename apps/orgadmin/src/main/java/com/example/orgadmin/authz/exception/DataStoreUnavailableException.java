package com.example.orgadmin.authz.exception;

/**
 * The permission data store could not be reached after retries.
 */
public class DataStoreUnavailableException extends RuntimeException {

    private final String operation;

    public DataStoreUnavailableException(String operation, Throwable cause) {
        super("Data store unavailable during " + operation + ": " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
