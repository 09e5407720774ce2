package com.foreman.dispatch.cli;

import com.foreman.core.model.InvalidTransitionException;
import com.foreman.core.persistence.StoreException;
import com.foreman.core.persistence.StoreSerializationException;
import com.foreman.core.persistence.TaskNotFoundException;
import com.foreman.core.service.BatchOperationException;
import com.foreman.core.service.TaskAlreadyExistsException;

/**
 * Process exit codes of the {@code foreman} command.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int GENERAL_ERROR = 1;
    public static final int INVALID_INPUT = 2;
    public static final int NOT_FOUND = 3;
    public static final int DEPENDENCY_NOT_MET = 4;
    public static final int ALREADY_EXISTS = 6;
    public static final int INVALID_STATE = 7;
    public static final int FILE_SYSTEM_ERROR = 8;
    public static final int PARSE_ERROR = 9;

    private ExitCodes() {}

    public static int of(Throwable error) {
        if (error instanceof BatchOperationException && error.getCause() != null) {
            return of(error.getCause());
        }
        if (error instanceof TaskNotFoundException) {
            return NOT_FOUND;
        }
        if (error instanceof TaskAlreadyExistsException) {
            return ALREADY_EXISTS;
        }
        if (error instanceof InvalidTransitionException || error instanceof IllegalStateException) {
            return INVALID_STATE;
        }
        if (error instanceof StoreSerializationException) {
            return PARSE_ERROR;
        }
        if (error instanceof StoreException) {
            return FILE_SYSTEM_ERROR;
        }
        if (error instanceof IllegalArgumentException) {
            return INVALID_INPUT;
        }
        return GENERAL_ERROR;
    }
}
