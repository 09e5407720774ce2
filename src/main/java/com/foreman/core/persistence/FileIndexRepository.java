package com.foreman.core.persistence;

import com.foreman.core.model.MetadataUpdate;
import com.foreman.core.model.TaskIds;
import com.foreman.core.model.TaskIndex;
import com.foreman.core.model.TaskIndexEntry;
import com.foreman.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index kept as {@code index.json} inside the tasks directory.
 */
public class FileIndexRepository implements IndexRepository {

    private static final Logger log = LoggerFactory.getLogger(FileIndexRepository.class);

    public static final String INDEX_FILE = "index.json";

    private final WorkspaceStore store;
    private final JsonDocuments json;
    private final Path tasksDir;
    private final Path indexPath;
    private final String documentExtension;
    private final Clock clock;

    public FileIndexRepository(WorkspaceStore store, JsonDocuments json, Path tasksDir,
                               String documentExtension, Clock clock) {
        this.store = store;
        this.json = json;
        this.tasksDir = tasksDir;
        this.indexPath = tasksDir.resolve(INDEX_FILE);
        this.documentExtension = documentExtension;
        this.clock = clock;
    }

    @Override
    public TaskIndex read() {
        if (!store.exists(indexPath)) {
            return TaskIndex.empty(clock.instant());
        }
        TaskIndex index = json.read(store.readString(indexPath), TaskIndex.class, indexPath.toString());
        for (Map.Entry<String, TaskIndexEntry> e : index.tasks().entrySet()) {
            String id = e.getKey();
            if (!TaskIds.isValid(id)) {
                throw new StoreSerializationException("Invalid task id '" + id + "' in " + indexPath);
            }
            TaskIndexEntry entry = e.getValue();
            if (entry == null) {
                throw new StoreSerializationException("Empty index entry for '" + id + "' in " + indexPath);
            }
            if (entry.status() == null || entry.module() == null) {
                throw new StoreSerializationException(
                        "Index entry for '" + id + "' needs status and module in " + indexPath);
            }
        }
        return index;
    }

    @Override
    public TaskIndex write(TaskIndex index) {
        TaskIndex stamped = index.withUpdatedAt(clock.instant());
        store.ensureDirectory(tasksDir);
        store.writeString(indexPath, json.write(stamped));
        log.debug("Wrote task index with {} entries", stamped.tasks().size());
        return stamped;
    }

    @Override
    public void upsertEntry(String taskId, TaskIndexEntry entry) {
        TaskIds.requireValid(taskId);
        write(read().withEntry(taskId, entry));
    }

    @Override
    public void updateStatus(String taskId, TaskStatus status) {
        TaskIndex index = read();
        TaskIndexEntry entry = index.tasks().get(taskId);
        if (entry == null) {
            throw new TaskNotFoundException(taskId);
        }
        write(index.withEntry(taskId, entry.withStatus(status)));
    }

    @Override
    public void removeEntry(String taskId) {
        TaskIndex index = read();
        if (index.tasks().containsKey(taskId)) {
            write(index.withoutEntry(taskId));
        }
    }

    @Override
    public List<String> queryByStatus(TaskStatus status) {
        return read().tasks().entrySet().stream()
                .filter(e -> e.getValue().status() == status)
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public List<String> allIds() {
        return List.copyOf(read().tasks().keySet());
    }

    @Override
    public boolean hasEntry(String taskId) {
        return read().tasks().containsKey(taskId);
    }

    @Override
    public Optional<TaskIndexEntry> getEntry(String taskId) {
        return Optional.ofNullable(read().tasks().get(taskId));
    }

    @Override
    public void updateMetadata(MetadataUpdate update) {
        TaskIndex index = read();
        write(index.withMetadata(index.metadata().merge(update)));
    }

    @Override
    public Optional<String> getNextTask() {
        // stable sort: equal priorities keep index order
        return read().tasks().entrySet().stream()
                .filter(e -> e.getValue().status() == TaskStatus.PENDING
                        || e.getValue().status() == TaskStatus.IN_PROGRESS)
                .sorted(Comparator.comparingInt(e -> e.getValue().priority()))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    @Override
    public Optional<Path> resolveTaskLocation(String taskId) {
        return getEntry(taskId).map(entry -> locate(taskId, entry));
    }

    Path locate(String taskId, TaskIndexEntry entry) {
        if (entry.filePath() != null && !entry.filePath().isBlank()) {
            return tasksDir.resolve(entry.filePath());
        }
        return tasksDir.resolve(relativeDocumentPath(taskId, entry.module(), documentExtension));
    }

    /**
     * {@code <module>/<id without the "module." prefix>.<ext>}, e.g. {@code auth/signup.ui.json}.
     */
    public static String relativeDocumentPath(String taskId, String module, String extension) {
        String prefix = module + ".";
        String name = taskId.startsWith(prefix) ? taskId.substring(prefix.length()) : taskId;
        return module + "/" + name + "." + extension;
    }

    public Path getTasksDir() {
        return tasksDir;
    }
}
