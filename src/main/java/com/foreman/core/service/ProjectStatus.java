package com.foreman.core.service;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the workspace for the {@code status} command.
 *
 * @param currentPhase phase value, or {@code "none"} without a session
 * @param byModule     per-module counts sorted by module name
 */
public record ProjectStatus(
        ProgressStats overall,
        List<ModuleStats> byModule,
        String currentPhase,
        String currentTask,
        Instant startedAt,
        Instant updatedAt,
        boolean hasActiveTasks
) {}
