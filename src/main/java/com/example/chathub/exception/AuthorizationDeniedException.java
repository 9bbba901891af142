package com.example.chathub.exception;

/**
 * The credential was rejected, or its bearer is not a member of the requested group.
 */
public class AuthorizationDeniedException extends RuntimeException {

    public AuthorizationDeniedException(String message) {
        super(message);
    }

    public AuthorizationDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
