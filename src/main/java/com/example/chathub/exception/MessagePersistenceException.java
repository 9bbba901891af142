package com.example.chathub.exception;

/**
 * Appending a message to the durable store failed. The message must not be broadcast.
 */
public class MessagePersistenceException extends RuntimeException {

    public MessagePersistenceException(String message) {
        super(message);
    }

    public MessagePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
