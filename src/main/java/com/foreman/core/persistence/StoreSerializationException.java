package com.foreman.core.persistence;

/**
 * Thrown when a persisted record cannot be parsed or written as JSON. Never retried.
 */
public class StoreSerializationException extends RuntimeException {
    public StoreSerializationException(String message) {
        super(message);
    }

    public StoreSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
