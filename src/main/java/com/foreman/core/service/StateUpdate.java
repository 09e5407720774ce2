package com.foreman.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.foreman.core.model.Phase;

/**
 * Partial update of the session state. Null fields are left untouched;
 * {@code clearCurrentTask} removes the current task explicitly.
 */
public record StateUpdate(
        Phase phase,
        String currentTask,
        boolean clearCurrentTask,
        JsonNode requirements,
        JsonNode addError
) {

    public static StateUpdate phase(Phase phase) {
        return new StateUpdate(phase, null, false, null, null);
    }

    public static StateUpdate currentTask(String taskId) {
        if (taskId == null) {
            return withoutCurrentTask();
        }
        return new StateUpdate(null, taskId, false, null, null);
    }

    public static StateUpdate withoutCurrentTask() {
        return new StateUpdate(null, null, true, null, null);
    }

    public static StateUpdate requirements(JsonNode requirements) {
        return new StateUpdate(null, null, false, requirements, null);
    }

    public static StateUpdate addError(JsonNode error) {
        return new StateUpdate(null, null, false, null, error);
    }
}
