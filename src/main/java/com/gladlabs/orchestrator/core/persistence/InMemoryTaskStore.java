package com.gladlabs.orchestrator.core.persistence;

import com.gladlabs.orchestrator.core.model.InvalidTransitionException;
import com.gladlabs.orchestrator.core.model.PhaseAttemptRecord;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskStateMachine;
import com.gladlabs.orchestrator.core.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Task store kept in memory. Used when no DataSource is configured; state is lost on restart.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<PhaseAttemptRecord>> attempts =
            new ConcurrentHashMap<>();

    @Override
    public Task create(Task task) {
        if (tasks.putIfAbsent(task.id(), task) != null) {
            throw new TaskStoreException("Task already exists: " + task.id());
        }
        return task;
    }

    @Override
    public Optional<Task> find(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public Optional<Task> claim(String id, Instant startedAt) {
        Task[] claimed = new Task[1];
        tasks.computeIfPresent(id, (k, current) -> {
            if (current.status() != TaskStatus.PENDING) {
                return current;
            }
            claimed[0] = TaskStateMachine.start(current, startedAt);
            return claimed[0];
        });
        return Optional.ofNullable(claimed[0]);
    }

    @Override
    public Task update(Task task) {
        Task stored = tasks.compute(task.id(), (k, current) -> {
            if (current == null) {
                throw new TaskStoreException("Task not found: " + task.id());
            }
            if (!current.status().canTransitionTo(task.status())) {
                throw new InvalidTransitionException(task.id(), current.status(), task.status());
            }
            return task;
        });
        return stored;
    }

    @Override
    public List<Task> list(int limit) {
        return tasks.values().stream()
                .sorted(Comparator.comparing(Task::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        return tasks.values().stream()
                .filter(t -> t.status() == status)
                .sorted(Comparator.comparing(Task::createdAt))
                .toList();
    }

    @Override
    public void recordAttempt(PhaseAttemptRecord attempt) {
        attempts.computeIfAbsent(attempt.executionId(), k -> new CopyOnWriteArrayList<>()).add(attempt);
    }

    @Override
    public List<PhaseAttemptRecord> attempts(String executionId) {
        List<PhaseAttemptRecord> rows = attempts.get(executionId);
        return rows == null ? List.of() : new ArrayList<>(rows);
    }

    @Override
    public boolean isHealthy() {
        return true;
    }
}
