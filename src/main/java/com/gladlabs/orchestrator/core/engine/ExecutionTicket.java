package com.gladlabs.orchestrator.core.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gladlabs.orchestrator.core.model.TaskStatus;

/**
 * Returned when an execution is accepted; the run itself happens asynchronously.
 */
public record ExecutionTicket(@JsonProperty("execution_id") String executionId, TaskStatus status) {
}
