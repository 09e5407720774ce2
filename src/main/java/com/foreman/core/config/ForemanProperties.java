package com.foreman.core.config;

import com.foreman.core.resilience.RetryPolicy;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Binds {@code foreman.*} from application.yml / environment variables.
 *
 * <pre>
 * foreman:
 *   workspace-dir: .
 *   retry:
 *     max-attempts: 3
 *     initial-delay-ms: 100
 *     max-delay-ms: 5000
 *     backoff-multiplier: 2.0
 *     retryable-errors: [EBUSY, ENOENT, EAGAIN, ETIMEDOUT]
 *   circuit-breaker:
 *     failure-threshold: 5
 *     timeout-seconds: 60
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "foreman")
public class ForemanProperties {

    /** Name of the engine's directory inside the workspace. */
    public static final String STATE_DIR = ".foreman";

    private String workspaceDir = ".";
    private Retry retry = new Retry();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @PostConstruct
    void validate() {
        toRetryPolicy();
        if (circuitBreaker.failureThreshold < 1) {
            throw new IllegalStateException("foreman.circuit-breaker.failure-threshold must be at least 1");
        }
        if (circuitBreaker.timeoutSeconds < 0) {
            throw new IllegalStateException("foreman.circuit-breaker.timeout-seconds must not be negative");
        }
    }

    public RetryPolicy toRetryPolicy() {
        try {
            return new RetryPolicy(retry.maxAttempts, Duration.ofMillis(retry.initialDelayMs),
                    Duration.ofMillis(retry.maxDelayMs), retry.backoffMultiplier,
                    new HashSet<>(retry.retryableErrors));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid foreman.retry settings: " + e.getMessage(), e);
        }
    }

    /** {@code <workspaceDir>/.foreman} */
    public Path stateDir() {
        return Path.of(workspaceDir).toAbsolutePath().normalize().resolve(STATE_DIR);
    }

    public Path tasksDir() {
        return stateDir().resolve("tasks");
    }

    public String getWorkspaceDir() { return workspaceDir; }
    public void setWorkspaceDir(String workspaceDir) { this.workspaceDir = workspaceDir; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public CircuitBreaker getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreaker circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public static class Retry {
        private int maxAttempts = 3;
        private long initialDelayMs = 100;
        private long maxDelayMs = 5000;
        private double backoffMultiplier = 2.0;
        private List<String> retryableErrors = new ArrayList<>(List.of("EBUSY", "ENOENT", "EAGAIN", "ETIMEDOUT"));

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getInitialDelayMs() { return initialDelayMs; }
        public void setInitialDelayMs(long initialDelayMs) { this.initialDelayMs = initialDelayMs; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public List<String> getRetryableErrors() { return retryableErrors; }
        public void setRetryableErrors(List<String> retryableErrors) { this.retryableErrors = retryableErrors; }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private long timeoutSeconds = 60;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
