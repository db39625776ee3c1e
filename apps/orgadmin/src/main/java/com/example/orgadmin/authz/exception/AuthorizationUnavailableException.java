package com.example.orgadmin.authz.exception;

/**
 * Authorization could not be decided because a backing service failed.
 * Callers must treat this as neither allow nor deny; the request layer maps it to 503.
 */
public class AuthorizationUnavailableException extends RuntimeException {

    public AuthorizationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
