package com.foreman.core.service;

import com.foreman.core.config.ForemanProperties;
import com.foreman.core.logging.MdcContext;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.Phase;
import com.foreman.core.model.SessionState;
import com.foreman.core.persistence.StateRepository;
import com.foreman.core.persistence.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Session lifecycle: initialization, partial updates, and archiving a finished
 * session out of the workspace directory.
 */
@Service
public class StateService {

    private static final Logger log = LoggerFactory.getLogger(StateService.class);

    static final String REQUIREMENTS_FILE = "requirements.md";

    /** Entries moved into the archive, in copy order. */
    static final List<String> ARCHIVED_ENTRIES = List.of(
            "state.json", REQUIREMENTS_FILE, "tasks", TaskService.PROGRESS_LOG, "circuit-breaker.log");

    private final StateRepository stateRepository;
    private final WorkspaceStore store;
    private final ForemanMetrics metrics;
    private final Path stateDir;
    private final Clock clock;

    public StateService(StateRepository stateRepository, WorkspaceStore store, ForemanMetrics metrics,
                        ForemanProperties properties, Clock clock) {
        this.stateRepository = stateRepository;
        this.store = store;
        this.metrics = metrics;
        this.stateDir = properties.stateDir();
        this.clock = clock;
    }

    public Optional<SessionState> getState() {
        return stateRepository.get();
    }

    public SessionState initializeState() {
        return initializeState(Phase.CLARIFY);
    }

    /**
     * Starts a new session in {@code phase}. An existing session is returned as is.
     */
    public SessionState initializeState(Phase phase) {
        Optional<SessionState> existing = stateRepository.get();
        if (existing.isPresent()) {
            log.warn("Session state already exists (phase {}), keeping it", existing.get().getPhase());
            return existing.get();
        }
        SessionState state = SessionState.createNew(phase, clock);
        stateRepository.save(state);
        MdcContext.setPhase(phase.value());
        log.info("Session state initialized in phase {}", phase);
        return state;
    }

    /**
     * Applies {@code update} to the stored session. A phase change must be a legal
     * transition from the current phase.
     *
     * @throws IllegalStateException if no session has been initialized
     * @throws com.foreman.core.model.InvalidTransitionException for an illegal phase change
     */
    public SessionState updateState(StateUpdate update) {
        SessionState state = requireState();
        if (update.phase() != null) {
            Phase from = state.getPhase();
            state.transitionTo(update.phase());
            if (from != update.phase()) {
                metrics.recordPhaseTransition(update.phase().value());
                log.info("Session phase {} -> {}", from, update.phase());
            }
            MdcContext.setPhase(update.phase().value());
        }
        if (update.clearCurrentTask()) {
            state.setCurrentTask(null);
        } else if (update.currentTask() != null) {
            state.setCurrentTask(update.currentTask());
        }
        if (update.requirements() != null) {
            state.setRequirementsPayload(update.requirements());
        }
        if (update.addError() != null) {
            state.addError(update.addError());
        }
        stateRepository.save(state);
        return state;
    }

    public SessionState setCurrentTask(String taskId) {
        log.debug("Setting current task to {}", taskId);
        return updateState(StateUpdate.currentTask(taskId));
    }

    public void clearState() {
        stateRepository.clear();
        MdcContext.clear();
        log.info("Session state cleared");
    }

    public boolean exists() {
        return stateRepository.exists();
    }

    /**
     * Moves the session's files into {@code archive/<timestamp>/}. Unless
     * {@code force} is set, a session that has not reached the complete phase is
     * left in place and reported as blocked.
     */
    public ArchiveResult archiveSession(boolean force) {
        boolean hasState = stateRepository.exists();
        boolean hasRequirements = store.exists(stateDir.resolve(REQUIREMENTS_FILE));
        boolean hasTasks = store.exists(stateDir.resolve("tasks"));
        if (!hasState && !hasRequirements && !hasTasks) {
            log.info("No session data to archive");
            return ArchiveResult.nothingToArchive();
        }

        if (hasState && !force) {
            Optional<SessionState> current = stateRepository.get();
            if (current.isPresent() && current.get().getPhase() != Phase.COMPLETE) {
                log.warn("Refusing to archive session in phase {} (use --force)", current.get().getPhase());
                return ArchiveResult.refused(current.get().getPhase());
            }
        }

        Path archiveDir = stateDir.resolve("archive").resolve(archiveTimestamp());
        store.ensureDirectory(archiveDir);
        var archived = new ArrayList<String>();
        for (String name : ARCHIVED_ENTRIES) {
            Path source = stateDir.resolve(name);
            if (store.exists(source)) {
                store.copy(source, archiveDir.resolve(name));
                archived.add(name);
                log.debug("Archived {}", name);
            }
        }
        // remove only after every copy succeeded
        for (String name : archived) {
            store.remove(stateDir.resolve(name));
        }
        MdcContext.clear();
        log.info("Session archived to {} ({} entries)", archiveDir, archived.size());
        return ArchiveResult.archived(archiveDir, archived);
    }

    /** ISO instant with ':' and '.' replaced, truncated to seconds: {@code 2025-01-15T10-30-00}. */
    String archiveTimestamp() {
        String iso = clock.instant().toString().replace(':', '-').replace('.', '-');
        return iso.length() > 19 ? iso.substring(0, 19) : iso;
    }

    private SessionState requireState() {
        return stateRepository.get()
                .orElseThrow(() -> new IllegalStateException("State not found. Initialize state first."));
    }
}
