package com.foreman.core;

import com.foreman.core.config.ForemanProperties;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.persistence.FileIndexRepository;
import com.foreman.core.persistence.FileStateRepository;
import com.foreman.core.persistence.FileTaskRepository;
import com.foreman.core.persistence.FileWorkspaceStore;
import com.foreman.core.persistence.JsonDocuments;
import com.foreman.core.persistence.JsonTaskDocumentCodec;
import com.foreman.core.resilience.RetryExecutor;
import com.foreman.core.resilience.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;

/**
 * Real file-backed components over a temporary workspace, wired the way
 * {@link com.foreman.core.config.ForemanConfig} wires them, with retry waits disabled.
 */
public class TestWorkspace {

    public final MutableClock clock = new MutableClock();
    public final ForemanProperties properties = new ForemanProperties();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final ForemanMetrics metrics = new ForemanMetrics(registry);
    public final JsonDocuments json = new JsonDocuments(JsonDocuments.defaultObjectMapper());
    public final FileWorkspaceStore store;
    public final FileIndexRepository index;
    public final FileTaskRepository tasks;
    public final FileStateRepository state;

    public TestWorkspace(Path root) {
        properties.setWorkspaceDir(root.toString());
        store = new FileWorkspaceStore(new RetryExecutor(RetryPolicy.DEFAULT, d -> { }, metrics::recordRetry));
        var codec = new JsonTaskDocumentCodec(json);
        index = new FileIndexRepository(store, json, properties.tasksDir(), codec.fileExtension(), clock);
        tasks = new FileTaskRepository(store, index, codec);
        state = new FileStateRepository(store, json, properties.stateDir(), clock);
    }

    public Path stateDir() {
        return properties.stateDir();
    }
}
