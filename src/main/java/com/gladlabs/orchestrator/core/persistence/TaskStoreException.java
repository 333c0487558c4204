package com.gladlabs.orchestrator.core.persistence;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;

/**
 * A task or workflow definition store could not complete an operation.
 */
public class TaskStoreException extends OrchestrationException {

    public TaskStoreException(String message) {
        super(message);
    }

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL;
    }
}
