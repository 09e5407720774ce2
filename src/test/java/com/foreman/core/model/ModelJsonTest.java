package com.foreman.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.foreman.core.MutableClock;
import com.foreman.core.persistence.JsonDocuments;
import com.foreman.core.persistence.StoreSerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Persisted shapes of the model types.
 */
class ModelJsonTest {

    private final ObjectMapper mapper = JsonDocuments.defaultObjectMapper();

    @Test
    @DisplayName("Task survives a JSON round trip with lowercase status and ISO timestamps")
    void taskRoundTrip() throws Exception {
        var clock = new MutableClock();
        Task task = Task.create("auth.signup.ui", "auth", 2, "Signup form",
                List.of("renders", "validates"), 45, List.of("auth.api"), TestRequirements.unitTests("**/*Signup*"));
        task.start(clock);
        clock.advance(Duration.ofMinutes(3));
        task.complete(clock);
        task.appendNote("Completed in 3m");

        String json = mapper.writeValueAsString(task);
        JsonNode tree = mapper.readTree(json);
        assertEquals("completed", tree.get("status").asText());
        assertEquals("2025-01-15T10:00:00Z", tree.get("startedAt").asText());
        assertFalse(tree.has("failedAt"));

        Task back = mapper.readValue(json, Task.class);
        assertEquals(task.getId(), back.getId());
        assertEquals(TaskStatus.COMPLETED, back.getStatus());
        assertEquals(task.getAcceptanceCriteria(), back.getAcceptanceCriteria());
        assertEquals(task.getDependencies(), back.getDependencies());
        assertEquals(task.getTestRequirements(), back.getTestRequirements());
        assertEquals(task.getCompletedAt(), back.getCompletedAt());
        assertEquals(3, back.getActualDuration().getAsLong());
        assertEquals("Completed in 3m", back.getNotes());
    }

    @Test
    @DisplayName("Missing status and dependencies default to pending and none")
    void taskDefaults() throws Exception {
        Task task = mapper.readValue("{\"id\":\"core.init\",\"module\":\"core\",\"priority\":1,"
                + "\"description\":\"Init\"}", Task.class);
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertTrue(task.getDependencies().isEmpty());
        assertFalse(task.hasDependencies());
    }

    @Test
    @DisplayName("SessionState survives a JSON round trip")
    void sessionStateRoundTrip() throws Exception {
        var clock = new MutableClock();
        SessionState state = SessionState.createNew(Phase.IMPLEMENT, clock);
        clock.advance(Duration.ofMinutes(1));
        state.setCurrentTask("auth.login");
        state.setRequirementsPayload(JsonNodeFactory.instance.objectNode().put("goal", "ship login"));
        state.addError(JsonNodeFactory.instance.objectNode().put("message", "flaky test"));

        String json = mapper.writeValueAsString(state);
        assertEquals("implement", mapper.readTree(json).get("phase").asText());

        SessionState back = mapper.readValue(json, SessionState.class);
        assertEquals(Phase.IMPLEMENT, back.getPhase());
        assertEquals("auth.login", back.getCurrentTask());
        assertEquals("ship login", back.getRequirementsPayload().get("goal").asText());
        assertEquals(1, back.getErrors().size());
        assertEquals(state.getStartedAt(), back.getStartedAt());
        assertEquals(state.getUpdatedAt(), back.getUpdatedAt());
    }

    @Test
    @DisplayName("Task index keeps entry order through JSON")
    void taskIndexOrder() throws Exception {
        var entry = new TaskIndexEntry(TaskStatus.PENDING, 1, "m", "d", null, List.of(), 30);
        TaskIndex index = TaskIndex.empty(Instant.parse("2025-01-15T10:00:00Z"))
                .withEntry("m.c", entry)
                .withEntry("m.a", entry)
                .withEntry("m.b", entry.withStatus(TaskStatus.COMPLETED));

        TaskIndex back = mapper.readValue(mapper.writeValueAsString(index), TaskIndex.class);
        assertEquals(List.of("m.c", "m.a", "m.b"), List.copyOf(back.tasks().keySet()));
        assertEquals(TaskStatus.COMPLETED, back.tasks().get("m.b").status());
        assertEquals(TaskIndex.CURRENT_VERSION, back.version());
        assertEquals("", back.metadata().projectGoal());
    }

    @Test
    @DisplayName("Metadata merge is shallow and keeps unspecified fields")
    void metadataMerge() {
        var config = JsonNodeFactory.instance.objectNode().put("language", "java");
        IndexMetadata metadata = new IndexMetadata("ship", config);

        IndexMetadata merged = metadata.merge(MetadataUpdate.projectGoal("ship faster"));
        assertEquals("ship faster", merged.projectGoal());
        assertEquals(config, merged.languageConfig());
    }

    @Test
    @DisplayName("Status and phase parse from lowercase values and enum names")
    void enumValues() {
        assertEquals(TaskStatus.IN_PROGRESS, TaskStatus.fromValue("in_progress"));
        assertEquals(TaskStatus.IN_PROGRESS, TaskStatus.fromValue("IN_PROGRESS"));
        assertEquals(Phase.HEAL, Phase.fromValue("heal"));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromValue("done"));
        assertEquals(Map.of(), TaskIndex.empty(Instant.EPOCH).tasks());
    }

    @Test
    @DisplayName("Task documents with inconsistent timestamps are rejected")
    void inconsistentTimestamps() {
        var json = new JsonDocuments(mapper);
        String bothTerminal = "{\"id\":\"a.b\",\"module\":\"a\",\"priority\":1,\"status\":\"completed\","
                + "\"completedAt\":\"2025-01-01T00:00:00Z\",\"failedAt\":\"2025-01-01T00:00:00Z\"}";
        String neverStarted = "{\"id\":\"a.b\",\"module\":\"a\",\"priority\":1,\"status\":\"failed\","
                + "\"failedAt\":\"2025-01-01T00:00:00Z\"}";
        String endsBeforeStart = "{\"id\":\"a.b\",\"module\":\"a\",\"priority\":1,\"status\":\"completed\","
                + "\"startedAt\":\"2025-01-01T01:00:00Z\",\"completedAt\":\"2025-01-01T00:00:00Z\"}";

        assertThrows(StoreSerializationException.class, () -> json.read(bothTerminal, Task.class, "a.b.json"));
        assertThrows(StoreSerializationException.class, () -> json.read(neverStarted, Task.class, "a.b.json"));
        assertThrows(StoreSerializationException.class, () -> json.read(endsBeforeStart, Task.class, "a.b.json"));
    }

    @Test
    @DisplayName("Task constructor enforces the timestamp invariant")
    void constructorInvariant() {
        Instant t = Instant.parse("2025-01-01T00:00:00Z");
        assertThrows(IllegalArgumentException.class, () -> new Task("a.b", "a", 1, TaskStatus.COMPLETED, "d",
                null, null, null, null, null, null, t, t));
        assertDoesNotThrow(() -> new Task("a.b", "a", 1, TaskStatus.COMPLETED, "d",
                null, null, null, null, null, t, t, null));
    }
}
