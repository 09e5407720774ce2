package com.foreman.core.persistence;

import com.foreman.core.resilience.CodedException;

/**
 * A workspace storage operation failed, after any retries it was entitled to.
 */
public class StoreException extends RuntimeException implements CodedException {

    private final String code;

    public StoreException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }
}
