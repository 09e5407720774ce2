package com.foreman.core.service;

public record BatchResult(String taskId, BatchOperation.Action action, boolean success, String error) {}
