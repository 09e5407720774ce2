package com.foreman.core.persistence;

import com.foreman.core.model.Task;
import com.foreman.core.model.TaskIndex;
import com.foreman.core.model.TaskIndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task documents under {@code <tasksDir>/<module>/}, one file per task.
 */
public class FileTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(FileTaskRepository.class);

    private final WorkspaceStore store;
    private final FileIndexRepository index;
    private final TaskDocumentCodec codec;

    public FileTaskRepository(WorkspaceStore store, FileIndexRepository index, TaskDocumentCodec codec) {
        this.store = store;
        this.index = index;
        this.codec = codec;
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return index.getEntry(taskId).flatMap(entry -> load(taskId, entry));
    }

    @Override
    public List<Task> findAll(TaskFilter filter) {
        TaskIndex snapshot = index.read();
        var tasks = new ArrayList<Task>();
        for (Map.Entry<String, TaskIndexEntry> e : snapshot.tasks().entrySet()) {
            if (filter.matches(e.getValue())) {
                load(e.getKey(), e.getValue()).ifPresent(tasks::add);
            }
        }
        return tasks;
    }

    @Override
    public void save(Task task) {
        String relative = FileIndexRepository.relativeDocumentPath(task.getId(), task.getModule(),
                codec.fileExtension());
        Path document = index.getTasksDir().resolve(relative);
        store.ensureDirectory(document.getParent());
        store.writeString(document, codec.encode(task));
        index.upsertEntry(task.getId(), TaskIndexEntry.of(task, relative));
        log.debug("Saved task {} ({})", task.getId(), task.getStatus());
    }

    @Override
    public void delete(String taskId) {
        Optional<TaskIndexEntry> entry = index.getEntry(taskId);
        if (entry.isEmpty()) {
            return;
        }
        store.remove(index.locate(taskId, entry.get()));
        index.removeEntry(taskId);
        log.debug("Deleted task {}", taskId);
    }

    private Optional<Task> load(String taskId, TaskIndexEntry entry) {
        Path document = index.locate(taskId, entry);
        if (!store.exists(document)) {
            log.warn("Task {} is indexed but its document {} is missing", taskId, document);
            return Optional.empty();
        }
        return Optional.of(codec.decode(store.readString(document), document.toString()));
    }
}
