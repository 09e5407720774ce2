package com.foreman.core.service;

import com.foreman.core.model.SessionState;
import com.foreman.core.model.TaskIndexEntry;
import com.foreman.core.persistence.IndexRepository;
import com.foreman.core.persistence.StateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Aggregates progress from the task index and the session state. Reads only the
 * index, never the task documents.
 */
@Service
public class StatusService {

    private static final Logger log = LoggerFactory.getLogger(StatusService.class);

    private final IndexRepository indexRepository;
    private final StateRepository stateRepository;

    public StatusService(IndexRepository indexRepository, StateRepository stateRepository) {
        this.indexRepository = indexRepository;
        this.stateRepository = stateRepository;
    }

    public ProjectStatus getProjectStatus() {
        Collection<TaskIndexEntry> entries = indexRepository.read().tasks().values();
        Optional<SessionState> state = stateRepository.get();

        Map<String, List<TaskIndexEntry>> byModule = new TreeMap<>();
        for (TaskIndexEntry entry : entries) {
            byModule.computeIfAbsent(entry.module(), m -> new ArrayList<>()).add(entry);
        }
        List<ModuleStats> modules = new ArrayList<>();
        byModule.forEach((module, moduleEntries) -> modules.add(new ModuleStats(module, ProgressStats.of(moduleEntries))));

        log.debug("Project status computed over {} tasks in {} modules", entries.size(), modules.size());
        return new ProjectStatus(
                ProgressStats.of(entries),
                List.copyOf(modules),
                state.map(s -> s.getPhase().value()).orElse("none"),
                state.map(SessionState::getCurrentTask).orElse(null),
                state.map(SessionState::getStartedAt).orElse(null),
                state.map(SessionState::getUpdatedAt).orElse(null),
                !entries.isEmpty());
    }
}
