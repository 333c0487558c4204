package com.gladlabs.orchestrator.core.engine;

import com.gladlabs.orchestrator.core.model.TaskStatus;

/**
 * Outcome of a cancel request.
 *
 * @param status   status the execution has, or will reach, after the request
 * @param accepted false when the execution had already completed or failed
 */
public record CancelResult(TaskStatus status, boolean accepted) {
}
