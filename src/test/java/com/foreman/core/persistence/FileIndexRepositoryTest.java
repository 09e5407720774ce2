package com.foreman.core.persistence;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.foreman.core.TestWorkspace;
import com.foreman.core.model.MetadataUpdate;
import com.foreman.core.model.TaskIndexEntry;
import com.foreman.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileIndexRepositoryTest {

    @TempDir
    Path root;

    private TestWorkspace workspace;
    private FileIndexRepository index;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(root);
        index = workspace.index;
    }

    private static TaskIndexEntry entry(TaskStatus status, int priority) {
        return new TaskIndexEntry(status, priority, "auth", "desc", null, List.of(), 30);
    }

    @Test
    @DisplayName("Empty index when nothing has been written")
    void emptyByDefault() {
        var empty = index.read();
        assertTrue(empty.tasks().isEmpty());
        assertEquals("1.0.0", empty.version());
        assertEquals("", empty.metadata().projectGoal());
    }

    @Test
    @DisplayName("write stamps updatedAt with the current time")
    void writeStamps() {
        workspace.clock.advance(Duration.ofMinutes(5));
        var written = index.write(index.read().withEntry("auth.login", entry(TaskStatus.PENDING, 1)));
        assertEquals(workspace.clock.instant(), written.updatedAt());
        assertEquals(workspace.clock.instant(), index.read().updatedAt());
    }

    @Test
    @DisplayName("Upsert, status update, query and removal")
    void crud() {
        index.upsertEntry("auth.login", entry(TaskStatus.PENDING, 1));
        index.upsertEntry("auth.logout", entry(TaskStatus.PENDING, 2));
        index.updateStatus("auth.login", TaskStatus.COMPLETED);

        assertEquals(List.of("auth.login"), index.queryByStatus(TaskStatus.COMPLETED));
        assertEquals(List.of("auth.login", "auth.logout"), index.allIds());
        assertTrue(index.hasEntry("auth.logout"));

        index.removeEntry("auth.logout");
        assertFalse(index.hasEntry("auth.logout"));
        assertDoesNotThrow(() -> index.removeEntry("auth.logout"));
    }

    @Test
    @DisplayName("updateStatus on an unknown id raises TaskNotFoundException")
    void updateUnknown() {
        var ex = assertThrows(TaskNotFoundException.class, () -> index.updateStatus("ghost", TaskStatus.FAILED));
        assertEquals("ghost", ex.getTaskId());
    }

    @Nested
    @DisplayName("Incomplete index entries raise StoreSerializationException")
    class IncompleteEntries {

        private void writeIndex(String tasksJson) {
            workspace.store.ensureDirectory(index.getTasksDir());
            workspace.store.writeString(index.getTasksDir().resolve(FileIndexRepository.INDEX_FILE),
                    "{\"version\":\"1.0.0\",\"tasks\":" + tasksJson + "}");
        }

        @Test
        @DisplayName("Entry without a status")
        void missingStatus() {
            writeIndex("{\"auth.login\":{\"priority\":1,\"module\":\"auth\"}}");
            assertThrows(StoreSerializationException.class, () -> index.read());
        }

        @Test
        @DisplayName("Entry without a module")
        void missingModule() {
            writeIndex("{\"auth.login\":{\"status\":\"pending\",\"priority\":1}}");
            assertThrows(StoreSerializationException.class, () -> index.read());
        }

        @Test
        @DisplayName("Null entry, also through getNextTask")
        void nullEntry() {
            writeIndex("{\"auth.login\":null}");
            assertThrows(StoreSerializationException.class, () -> index.read());
            assertThrows(StoreSerializationException.class, () -> index.getNextTask());
        }
    }

    @Test
    @DisplayName("Invalid ids are rejected on upsert")
    void invalidKeyOnUpsert() {
        assertThrows(IllegalArgumentException.class, () -> index.upsertEntry("bad id", entry(TaskStatus.PENDING, 1)));
    }

    @Test
    @DisplayName("Malformed or invalid index content raises StoreSerializationException")
    void malformedIndex() {
        Path file = index.getTasksDir().resolve(FileIndexRepository.INDEX_FILE);
        workspace.store.ensureDirectory(index.getTasksDir());

        workspace.store.writeString(file, "{ not json");
        assertThrows(StoreSerializationException.class, () -> index.read());

        workspace.store.writeString(file, "{\"version\":\"1.0.0\",\"tasks\":{\"bad id\":{\"status\":\"pending\","
                + "\"priority\":1,\"module\":\"m\",\"description\":\"d\"}}}");
        assertThrows(StoreSerializationException.class, () -> index.read());
    }

    @Test
    @DisplayName("Metadata updates merge shallowly")
    void metadataMerge() {
        var config = JsonNodeFactory.instance.objectNode().put("language", "java");
        index.updateMetadata(MetadataUpdate.languageConfig(config));
        index.updateMetadata(MetadataUpdate.projectGoal("ship login"));

        var metadata = index.read().metadata();
        assertEquals("ship login", metadata.projectGoal());
        assertEquals("java", metadata.languageConfig().get("language").asText());
    }

    @Nested
    @DisplayName("getNextTask")
    class NextTask {

        @Test
        @DisplayName("Lowest priority number among pending and in-progress entries wins")
        void lowestPriority() {
            index.upsertEntry("a", entry(TaskStatus.PENDING, 3));
            index.upsertEntry("b", entry(TaskStatus.IN_PROGRESS, 2));
            index.upsertEntry("c", entry(TaskStatus.COMPLETED, 1));
            assertEquals(Optional.of("b"), index.getNextTask());
        }

        @Test
        @DisplayName("Ties keep insertion order")
        void ties() {
            index.upsertEntry("x", entry(TaskStatus.PENDING, 1));
            index.upsertEntry("y", entry(TaskStatus.PENDING, 1));
            assertEquals(Optional.of("x"), index.getNextTask());
        }

        @Test
        @DisplayName("Dependencies are ignored at this level")
        void dependencyNaive() {
            index.upsertEntry("dep", entry(TaskStatus.PENDING, 5));
            index.upsertEntry("blocked", new TaskIndexEntry(TaskStatus.PENDING, 1, "auth", "d", null,
                    List.of("dep"), 30));
            assertEquals(Optional.of("blocked"), index.getNextTask());
        }

        @Test
        @DisplayName("Empty when only finished tasks remain")
        void nothingLeft() {
            index.upsertEntry("a", entry(TaskStatus.COMPLETED, 1));
            index.upsertEntry("b", entry(TaskStatus.FAILED, 1));
            assertTrue(index.getNextTask().isEmpty());
        }
    }

    @Test
    @DisplayName("Task location: explicit filePath, otherwise derived from module and id")
    void resolveLocation() {
        index.upsertEntry("auth.signup.ui", entry(TaskStatus.PENDING, 1));
        index.upsertEntry("auth.login", new TaskIndexEntry(TaskStatus.PENDING, 1, "auth", "d",
                "custom/login.json", List.of(), null));

        assertEquals(Optional.of(index.getTasksDir().resolve("auth/signup.ui.json")),
                index.resolveTaskLocation("auth.signup.ui"));
        assertEquals(Optional.of(index.getTasksDir().resolve("custom/login.json")),
                index.resolveTaskLocation("auth.login"));
        assertTrue(index.resolveTaskLocation("ghost").isEmpty());
        assertEquals("core/setup.json", FileIndexRepository.relativeDocumentPath("setup", "core", "json"));
    }
}
