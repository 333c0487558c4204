package com.gladlabs.orchestrator.core.engine;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;

public class ExecutionNotFoundException extends OrchestrationException {

    public ExecutionNotFoundException(String executionId) {
        super("Execution not found: " + executionId);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION_FAILURE;
    }
}
