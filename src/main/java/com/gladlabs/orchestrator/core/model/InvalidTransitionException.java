package com.gladlabs.orchestrator.core.model;

import java.util.Set;

/**
 * Thrown when a {@link Task} is asked to move to a status its current status
 * cannot reach.
 */
public class InvalidTransitionException extends OrchestrationException {

    private final String taskId;
    private final TaskStatus currentStatus;
    private final TaskStatus requestedStatus;

    public InvalidTransitionException(String taskId, TaskStatus currentStatus, TaskStatus requestedStatus) {
        super(String.format("Invalid transition for '%s': %s → %s. Valid targets: %s",
                taskId, currentStatus, requestedStatus, format(currentStatus.validTargets())));
        this.taskId = taskId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getCurrentStatus() {
        return currentStatus;
    }

    public TaskStatus getRequestedStatus() {
        return requestedStatus;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL;
    }

    private static String format(Set<TaskStatus> targets) {
        return targets.isEmpty() ? "(none, terminal state)" : targets.toString();
    }
}
