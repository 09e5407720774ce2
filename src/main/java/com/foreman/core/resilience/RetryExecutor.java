package com.foreman.core.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Runs I/O operations with bounded exponential backoff.
 * <p>
 * Only errors whose code is on the policy's allow-list are retried. Any other
 * error, or an allow-listed one on the last attempt, is rethrown unchanged.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy defaultPolicy;
    private final Sleeper sleeper;
    private final Consumer<String> retryListener;

    public RetryExecutor(RetryPolicy defaultPolicy) {
        this(defaultPolicy, Sleeper.THREAD, code -> { });
    }

    /**
     * @param retryListener told the error code each time an attempt is retried
     */
    public RetryExecutor(RetryPolicy defaultPolicy, Sleeper sleeper, Consumer<String> retryListener) {
        this.defaultPolicy = defaultPolicy;
        this.sleeper = sleeper;
        this.retryListener = retryListener;
    }

    public <T> T execute(IoOperation<T> operation) throws IOException {
        return execute(operation, defaultPolicy);
    }

    public <T> T execute(IoOperation<T> operation, RetryPolicy policy) throws IOException {
        Duration delay = policy.initialDelay();
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            } catch (IOException e) {
                awaitRetry(e, attempt, delay, policy);
            } catch (RuntimeException e) {
                awaitRetry(e, attempt, delay, policy);
            }
            delay = policy.nextDelay(delay);
        }
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    private <X extends Exception> void awaitRetry(X error, int attempt, Duration delay, RetryPolicy policy)
            throws X {
        String code = ErrorCodes.codeOf(error);
        if (code == null || !policy.retryableErrors().contains(code) || attempt >= policy.maxAttempts()) {
            throw error;
        }
        log.debug("Attempt {}/{} failed with {}, retrying in {}ms", attempt, policy.maxAttempts(), code,
                delay.toMillis());
        retryListener.accept(code);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw error;
        }
    }
}
