package com.gladlabs.orchestrator.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * The only code path that changes {@link Task#status()}.
 * <p>
 * Every method validates the move against {@link TaskStatus#canTransitionTo(TaskStatus)}
 * and throws {@link InvalidTransitionException} otherwise. Terminal moves stamp
 * {@code completedAt}; nothing else does.
 */
public final class TaskStateMachine {

    private TaskStateMachine() {}

    public static Task start(Task task, Instant now) {
        check(task, TaskStatus.PROCESSING);
        if (task.status() == TaskStatus.PROCESSING) {
            return task;
        }
        return copy(task, TaskStatus.PROCESSING, now, null, task.result(), task.error());
    }

    public static Task complete(Task task, Map<String, Object> result, Instant now) {
        check(task, TaskStatus.COMPLETED);
        return copy(task, TaskStatus.COMPLETED, task.startedAt(), now, result, null);
    }

    public static Task fail(Task task, TaskError error, Instant now) {
        check(task, TaskStatus.FAILED);
        return copy(task, TaskStatus.FAILED, task.startedAt(), now, task.result(), error);
    }

    public static Task cancel(Task task, Instant now) {
        check(task, TaskStatus.CANCELLED);
        return copy(task, TaskStatus.CANCELLED, task.startedAt(), now, task.result(),
                TaskError.of(ErrorKind.CANCELLED, "Execution cancelled"));
    }

    private static void check(Task task, TaskStatus target) {
        if (!task.status().canTransitionTo(target)) {
            throw new InvalidTransitionException(task.id(), task.status(), target);
        }
    }

    private static Task copy(Task task, TaskStatus status, Instant startedAt, Instant completedAt,
                             Map<String, Object> result, TaskError error) {
        return new Task(task.id(), status, task.workflowId(), task.input(), task.createdAt(),
                startedAt, completedAt, task.retryCount(), result, error, task.currentPhase(),
                task.completedPhases(), task.totalPhases(), task.phaseResults(), task.tags());
    }
}
