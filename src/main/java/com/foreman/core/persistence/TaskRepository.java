package com.foreman.core.persistence;

import com.foreman.core.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * Full task documents, kept in step with the {@link IndexRepository}.
 */
public interface TaskRepository {

    Optional<Task> findById(String taskId);

    /** Tasks whose index entry matches {@code filter}, in index order. */
    List<Task> findAll(TaskFilter filter);

    /** Writes the task document and upserts its index entry. */
    void save(Task task);

    /** Removes the document and the index entry. A missing id is ignored. */
    void delete(String taskId);
}
