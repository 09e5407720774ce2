package com.foreman.core.service;

public class TaskAlreadyExistsException extends IllegalArgumentException {

    private final String taskId;

    public TaskAlreadyExistsException(String taskId) {
        super("Task already exists: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
