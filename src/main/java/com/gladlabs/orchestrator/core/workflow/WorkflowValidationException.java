package com.gladlabs.orchestrator.core.workflow;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;

/**
 * A workflow definition failed validation; nothing was created.
 */
public class WorkflowValidationException extends OrchestrationException {

    private final ValidationReport report;

    public WorkflowValidationException(ValidationReport report) {
        super("Workflow validation failed: " + String.join(", ", report.errors()));
        this.report = report;
    }

    public ValidationReport getReport() {
        return report;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION_FAILURE;
    }
}
