package com.foreman.core.persistence;

import com.foreman.core.TestWorkspace;
import com.foreman.core.model.Phase;
import com.foreman.core.model.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FileStateRepositoryTest {

    @TempDir
    Path root;

    private TestWorkspace workspace;
    private FileStateRepository repository;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(root);
        repository = workspace.state;
    }

    @Test
    @DisplayName("No state file -> empty")
    void emptyWhenAbsent() {
        assertFalse(repository.exists());
        assertTrue(repository.get().isEmpty());
    }

    @Test
    @DisplayName("save then get returns the same session, stamped by the repository clock")
    void saveAndGet() {
        repository.save(SessionState.createNew(Phase.BREAKDOWN, workspace.clock));
        assertTrue(Files.exists(root.resolve(".foreman/state.json")));

        SessionState loaded = repository.get().orElseThrow();
        assertEquals(Phase.BREAKDOWN, loaded.getPhase());

        workspace.clock.advance(Duration.ofMinutes(2));
        loaded.transitionTo(Phase.IMPLEMENT);
        assertEquals(workspace.clock.instant(), loaded.getUpdatedAt());
    }

    @Test
    @DisplayName("clear removes the state file")
    void clear() {
        repository.save(SessionState.createNew(workspace.clock));
        repository.clear();
        assertFalse(repository.exists());
        assertDoesNotThrow(repository::clear);
    }

    @Test
    @DisplayName("A corrupt state file raises StoreSerializationException")
    void corrupt() {
        workspace.store.ensureDirectory(workspace.stateDir());
        workspace.store.writeString(repository.getStatePath(), "{\"phase\":\"nowhere\"}");
        assertThrows(StoreSerializationException.class, () -> repository.get());
    }
}
