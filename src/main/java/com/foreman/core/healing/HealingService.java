package com.foreman.core.healing;

import com.foreman.core.logging.MdcContext;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.persistence.StoreException;
import com.foreman.core.persistence.WorkspaceStore;
import com.foreman.core.resilience.CircuitBreaker;
import com.foreman.core.resilience.CircuitOpenException;
import com.foreman.core.resilience.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs repair operations for failing tasks behind a {@link CircuitBreaker}, so
 * a run of failed repairs stops further attempts for a cool-down period.
 * <p>
 * Every state change of the breaker observed after an attempt is appended to
 * {@code circuit-breaker.log} in the workspace directory. An operation that returns
 * {@code false} is a failed attempt in the statistics but a successful call as
 * far as the breaker is concerned.
 */
public class HealingService {

    private static final Logger log = LoggerFactory.getLogger(HealingService.class);

    public static final String AUDIT_LOG = "circuit-breaker.log";

    private final CircuitBreaker breaker;
    private final WorkspaceStore store;
    private final Path auditLog;
    private final ForemanMetrics metrics;
    private final Clock clock;

    private final Map<String, Integer> attemptsByTask = new ConcurrentHashMap<>();
    private int totalAttempts;
    private int successfulAttempts;
    private int failedAttempts;
    private int circuitOpenCount;
    private CircuitState lastObservedState;

    public HealingService(CircuitBreaker breaker, WorkspaceStore store, Path stateDir,
                          ForemanMetrics metrics, Clock clock) {
        this.breaker = breaker;
        this.store = store;
        this.auditLog = stateDir.resolve(AUDIT_LOG);
        this.metrics = metrics;
        this.clock = clock;
        this.lastObservedState = breaker.getState();
    }

    /**
     * Runs {@code operation} through the breaker. Never throws for a failed or
     * rejected repair: the failure is reported in the result.
     */
    public synchronized HealingResult attemptHealing(String taskId, HealingOperation operation) {
        int attempt = attemptsByTask.merge(taskId, 1, Integer::sum);
        totalAttempts++;
        MdcContext.setTask(taskId);
        try {
            log.info("Healing attempt {} for task {}", attempt, taskId);
            boolean healed = breaker.execute(operation::heal);
            if (healed) {
                successfulAttempts++;
            } else {
                failedAttempts++;
                log.warn("Healing operation for task {} reported no fix (attempt {})", taskId, attempt);
            }
            metrics.recordHealingAttempt(healed);
            CircuitState state = observeState();
            return new HealingResult(healed, taskId, attempt, state, null);
        } catch (Exception e) {
            failedAttempts++;
            metrics.recordHealingAttempt(false);
            CircuitState state = observeState();
            if (e instanceof CircuitOpenException) {
                log.warn("Healing for task {} rejected (attempt {}, circuit {}): {}",
                        taskId, attempt, state, e.getMessage());
            } else {
                log.error("Healing failed for task {} (attempt {}, circuit {}): {}",
                        taskId, attempt, state, e.getMessage());
            }
            return new HealingResult(false, taskId, attempt, state, e);
        } finally {
            MdcContext.clearTask();
        }
    }

    public CircuitState getCircuitState() {
        return breaker.getState();
    }

    public synchronized HealingStats getHealingStats() {
        return new HealingStats(totalAttempts, successfulAttempts, failedAttempts,
                circuitOpenCount, breaker.getState());
    }

    /** Attempts made so far for {@code taskId}. */
    public int getAttemptCount(String taskId) {
        return attemptsByTask.getOrDefault(taskId, 0);
    }

    /** Closes the circuit and clears its failure count. Statistics are kept. */
    public synchronized void resetCircuit() {
        breaker.reset();
        observeState();
        log.info("Circuit breaker reset");
    }

    private CircuitState observeState() {
        CircuitState current = breaker.getState();
        if (current != lastObservedState) {
            if (current == CircuitState.OPEN) {
                circuitOpenCount++;
                log.error("Circuit breaker opened after repeated healing failures");
            }
            lastObservedState = current;
            metrics.recordCircuitStateChange(current);
            appendAudit(current);
        }
        return current;
    }

    private void appendAudit(CircuitState state) {
        String line = "[" + clock.instant() + "] Circuit state: " + state + "\n";
        try {
            store.ensureDirectory(auditLog.getParent());
            store.append(auditLog, line);
        } catch (StoreException e) {
            log.error("Failed to write circuit breaker audit log {}: {}", auditLog, e.getMessage());
        }
    }
}
