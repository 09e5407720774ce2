package com.foreman.core.resilience;

import java.io.IOException;

/**
 * A single attempt of an I/O operation run by {@link RetryExecutor}.
 */
@FunctionalInterface
public interface IoOperation<T> {
    T call() throws IOException;
}
