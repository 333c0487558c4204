package com.gladlabs.orchestrator.core.workflow;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;

public class WorkflowNotFoundException extends OrchestrationException {

    public WorkflowNotFoundException(String workflowId) {
        super("Workflow not found: " + workflowId);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION_FAILURE;
    }
}
