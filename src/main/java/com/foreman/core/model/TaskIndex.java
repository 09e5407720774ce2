package com.foreman.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The persisted task index: version, metadata and one entry per task id.
 * Entry order is insertion order.
 */
public record TaskIndex(
    String version,
    Instant updatedAt,
    IndexMetadata metadata,
    Map<String, TaskIndexEntry> tasks
) {

    public static final String CURRENT_VERSION = "1.0.0";

    public TaskIndex {
        metadata = metadata != null ? metadata : IndexMetadata.empty();
        tasks = tasks != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tasks)) : Map.of();
    }

    public static TaskIndex empty(Instant now) {
        return new TaskIndex(CURRENT_VERSION, now, IndexMetadata.empty(), Map.of());
    }

    public TaskIndex withUpdatedAt(Instant instant) {
        return new TaskIndex(version, instant, metadata, tasks);
    }

    public TaskIndex withMetadata(IndexMetadata newMetadata) {
        return new TaskIndex(version, updatedAt, newMetadata, tasks);
    }

    public TaskIndex withEntry(String id, TaskIndexEntry entry) {
        var copy = new LinkedHashMap<>(tasks);
        copy.put(id, entry);
        return new TaskIndex(version, updatedAt, metadata, copy);
    }

    public TaskIndex withoutEntry(String id) {
        var copy = new LinkedHashMap<>(tasks);
        copy.remove(id);
        return new TaskIndex(version, updatedAt, metadata, copy);
    }
}
