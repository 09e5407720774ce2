package com.foreman.core.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Three-state failure guard around a repeatedly invoked operation.
 * <ul>
 *   <li>CLOSED: calls run; consecutive failures are counted and the circuit
 *       opens once the count reaches the threshold. A success resets the count.</li>
 *   <li>OPEN: calls are rejected with {@link CircuitOpenException} without running,
 *       until {@code openTimeout} has elapsed since opening.</li>
 *   <li>HALF_OPEN: exactly one trial call runs. Success closes the circuit,
 *       failure opens it again with a fresh opening instant.</li>
 * </ul>
 * State lives in memory only; a new instance always starts CLOSED.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(60);

    private final String name;
    private final int failureThreshold;
    private final Duration openTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name) {
        this(name, DEFAULT_FAILURE_THRESHOLD, DEFAULT_OPEN_TIMEOUT, Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, Duration openTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (openTimeout == null || openTimeout.isNegative()) {
            throw new IllegalArgumentException("openTimeout must not be negative");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.openTimeout = openTimeout;
        this.clock = clock;
    }

    /**
     * Runs {@code operation} if the circuit admits it. Exceptions thrown by the
     * operation are recorded as failures and rethrown unchanged.
     *
     * @throws CircuitOpenException if the circuit is open, or half-open with its trial call already running
     */
    public <T, E extends Exception> T execute(GuardedOperation<T, E> operation) throws E {
        acquire();
        boolean succeeded = false;
        try {
            T result = operation.run();
            succeeded = true;
            return result;
        } finally {
            if (succeeded) {
                onSuccess();
            } else {
                onFailure();
            }
        }
    }

    private synchronized void acquire() {
        if (state == CircuitState.OPEN) {
            Duration elapsed = Duration.between(openedAt, clock.instant());
            if (elapsed.compareTo(openTimeout) < 0) {
                throw new CircuitOpenException(
                        "Circuit breaker '" + name + "' is OPEN (opened at " + openedAt + ")", openedAt);
            }
            moveTo(CircuitState.HALF_OPEN);
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                throw new CircuitOpenException(
                        "Circuit breaker '" + name + "' is HALF_OPEN with a trial call in progress", openedAt);
            }
            trialInFlight = true;
        }
    }

    private synchronized void onSuccess() {
        failureCount = 0;
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            moveTo(CircuitState.CLOSED);
        }
    }

    private synchronized void onFailure() {
        failureCount++;
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            open();
        } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            open();
        }
    }

    private void open() {
        openedAt = clock.instant();
        moveTo(CircuitState.OPEN);
    }

    private void moveTo(CircuitState next) {
        if (next != state) {
            log.info("Circuit breaker '{}' {} -> {} (failures={})", name, state, next, failureCount);
            state = next;
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerMetrics getMetrics() {
        return new CircuitBreakerMetrics(state, failureCount, openedAt);
    }

    /** Forces the circuit back to CLOSED with a zero failure count. */
    public synchronized void reset() {
        failureCount = 0;
        openedAt = null;
        trialInFlight = false;
        moveTo(CircuitState.CLOSED);
    }

    public String getName() {
        return name;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getOpenTimeout() {
        return openTimeout;
    }
}
