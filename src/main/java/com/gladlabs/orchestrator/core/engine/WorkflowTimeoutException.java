package com.gladlabs.orchestrator.core.engine;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;

/**
 * The execution ran past its workflow deadline.
 */
public class WorkflowTimeoutException extends OrchestrationException {

    public WorkflowTimeoutException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.WORKFLOW_TIMEOUT;
    }
}
