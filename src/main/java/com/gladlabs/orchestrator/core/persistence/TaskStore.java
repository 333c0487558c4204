package com.gladlabs.orchestrator.core.persistence;

import com.gladlabs.orchestrator.core.model.PhaseAttemptRecord;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of {@link Task} records and their phase-attempt audit rows.
 * <p>
 * Implementations enforce the status state machine on every write: an update whose
 * target status the stored status cannot reach is rejected with
 * {@link com.gladlabs.orchestrator.core.model.InvalidTransitionException}.
 */
public interface TaskStore {

    /**
     * Inserts a new task.
     *
     * @throws TaskStoreException when a task with the same id exists
     */
    Task create(Task task);

    Optional<Task> find(String id);

    /**
     * Atomically moves a pending task to processing.
     *
     * @return the claimed task, or empty when the task is missing or no longer pending
     */
    Optional<Task> claim(String id, Instant startedAt);

    /**
     * Replaces the stored task, validating the status transition against the stored row.
     */
    Task update(Task task);

    /** Most recent tasks first. */
    List<Task> list(int limit);

    List<Task> findByStatus(TaskStatus status);

    void recordAttempt(PhaseAttemptRecord attempt);

    /** Attempts of one execution in the order they were recorded. */
    List<PhaseAttemptRecord> attempts(String executionId);

    /** Cheap connectivity check used by health reporting. */
    boolean isHealthy();
}
