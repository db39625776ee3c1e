package com.example.orgadmin.authz.exception;

/**
 * No authenticated actor was attached to the request.
 */
public class MissingActorException extends RuntimeException {

    public MissingActorException(String message) {
        super(message);
    }
}
