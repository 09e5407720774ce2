package com.foreman.core.persistence;

import com.foreman.core.model.MetadataUpdate;
import com.foreman.core.model.TaskIndex;
import com.foreman.core.model.TaskIndexEntry;
import com.foreman.core.model.TaskStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Persistent registry of lightweight task records.
 * <p>
 * {@link #getNextTask()} only looks at status and priority. Dependency gating
 * needs full tasks and is done by the caller (see
 * {@link com.foreman.core.scheduler.TaskScheduler}).
 */
public interface IndexRepository {

    /** The persisted index, or a fresh empty one if nothing has been written yet. */
    TaskIndex read();

    /** Stamps {@code updatedAt} and persists the whole index. Returns what was written. */
    TaskIndex write(TaskIndex index);

    void upsertEntry(String taskId, TaskIndexEntry entry);

    /**
     * @throws TaskNotFoundException if the id has no entry
     */
    void updateStatus(String taskId, TaskStatus status);

    /** Removes an entry; a missing id is ignored. */
    void removeEntry(String taskId);

    List<String> queryByStatus(TaskStatus status);

    List<String> allIds();

    boolean hasEntry(String taskId);

    Optional<TaskIndexEntry> getEntry(String taskId);

    void updateMetadata(MetadataUpdate update);

    /** Lowest-priority pending or in-progress entry, ignoring dependencies. */
    Optional<String> getNextTask();

    /** Where the task document for {@code taskId} lives, if the id is indexed. */
    Optional<Path> resolveTaskLocation(String taskId);
}
