package com.foreman.core.resilience;

/**
 * An operation run under a {@link CircuitBreaker}.
 *
 * @param <T> result type
 * @param <E> checked exception the operation may throw
 */
@FunctionalInterface
public interface GuardedOperation<T, E extends Exception> {
    T run() throws E;
}
