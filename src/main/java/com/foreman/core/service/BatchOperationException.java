package com.foreman.core.service;

import java.util.List;

/**
 * An atomic batch failed and the tasks it touched were restored.
 */
public class BatchOperationException extends RuntimeException {

    private final List<BatchResult> results;

    public BatchOperationException(String message, List<BatchResult> results, Throwable cause) {
        super(message, cause);
        this.results = List.copyOf(results);
    }

    /** Results up to and including the failed step. */
    public List<BatchResult> getResults() {
        return results;
    }
}
