package com.foreman.core.resilience;

/**
 * An exception that carries an errno-style code such as {@code EBUSY}.
 */
public interface CodedException {
    String getCode();
}
