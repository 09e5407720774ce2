package com.foreman.core.config;

import com.foreman.core.healing.HealingService;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.persistence.FileIndexRepository;
import com.foreman.core.persistence.FileStateRepository;
import com.foreman.core.persistence.FileTaskRepository;
import com.foreman.core.persistence.FileWorkspaceStore;
import com.foreman.core.persistence.JsonDocuments;
import com.foreman.core.persistence.JsonTaskDocumentCodec;
import com.foreman.core.persistence.StateRepository;
import com.foreman.core.persistence.TaskDocumentCodec;
import com.foreman.core.persistence.TaskRepository;
import com.foreman.core.persistence.WorkspaceStore;
import com.foreman.core.resilience.CircuitBreaker;
import com.foreman.core.resilience.RetryExecutor;
import com.foreman.core.resilience.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the file-backed store, repositories and resilience components for the
 * workspace named by {@link ForemanProperties}.
 */
@Configuration
public class ForemanConfig {

    private static final Logger log = LoggerFactory.getLogger(ForemanConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * In-process registry, used when no monitoring backend provides one.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public JsonDocuments jsonDocuments() {
        return new JsonDocuments(JsonDocuments.defaultObjectMapper());
    }

    @Bean
    public RetryExecutor retryExecutor(ForemanProperties properties, ForemanMetrics metrics) {
        return new RetryExecutor(properties.toRetryPolicy(), Sleeper.THREAD, metrics::recordRetry);
    }

    @Bean
    public WorkspaceStore workspaceStore(RetryExecutor retryExecutor, ForemanProperties properties) {
        log.info("Using workspace {}", properties.stateDir());
        return new FileWorkspaceStore(retryExecutor);
    }

    @Bean
    public TaskDocumentCodec taskDocumentCodec(JsonDocuments json) {
        return new JsonTaskDocumentCodec(json);
    }

    @Bean
    public FileIndexRepository indexRepository(WorkspaceStore store, JsonDocuments json, TaskDocumentCodec codec,
                                               ForemanProperties properties, Clock clock) {
        return new FileIndexRepository(store, json, properties.tasksDir(), codec.fileExtension(), clock);
    }

    @Bean
    public TaskRepository taskRepository(WorkspaceStore store, FileIndexRepository index, TaskDocumentCodec codec) {
        return new FileTaskRepository(store, index, codec);
    }

    @Bean
    public StateRepository stateRepository(WorkspaceStore store, JsonDocuments json,
                                           ForemanProperties properties, Clock clock) {
        return new FileStateRepository(store, json, properties.stateDir(), clock);
    }

    @Bean
    public CircuitBreaker healingCircuitBreaker(ForemanProperties properties, Clock clock) {
        var settings = properties.getCircuitBreaker();
        return new CircuitBreaker("healing", settings.getFailureThreshold(),
                Duration.ofSeconds(settings.getTimeoutSeconds()), clock);
    }

    @Bean
    public HealingService healingService(CircuitBreaker healingCircuitBreaker, WorkspaceStore store,
                                         ForemanProperties properties, ForemanMetrics metrics, Clock clock) {
        return new HealingService(healingCircuitBreaker, store, properties.stateDir(), metrics, clock);
    }
}
