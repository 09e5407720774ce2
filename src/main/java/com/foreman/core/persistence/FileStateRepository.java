package com.foreman.core.persistence;

import com.foreman.core.model.SessionState;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

/**
 * Session state kept as {@code state.json} in the workspace directory.
 */
public class FileStateRepository implements StateRepository {

    public static final String STATE_FILE = "state.json";

    private final WorkspaceStore store;
    private final JsonDocuments json;
    private final Path stateDir;
    private final Path statePath;
    private final Clock clock;

    public FileStateRepository(WorkspaceStore store, JsonDocuments json, Path stateDir, Clock clock) {
        this.store = store;
        this.json = json;
        this.clock = clock;
        this.stateDir = stateDir;
        this.statePath = stateDir.resolve(STATE_FILE);
    }

    @Override
    public Optional<SessionState> get() {
        if (!store.exists(statePath)) {
            return Optional.empty();
        }
        SessionState state = json.read(store.readString(statePath), SessionState.class, statePath.toString());
        return Optional.of(state.withClock(clock));
    }

    @Override
    public void save(SessionState state) {
        store.ensureDirectory(stateDir);
        store.writeString(statePath, json.write(state));
    }

    @Override
    public void clear() {
        store.remove(statePath);
    }

    @Override
    public boolean exists() {
        return store.exists(statePath);
    }

    public Path getStatePath() {
        return statePath;
    }
}
