package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One workflow execution, persisted by the task store.
 * <p>
 * Immutable: every state change produces a new instance through {@link TaskStateMachine}
 * or one of the {@code with*} helpers. {@code completedAt} is non-null exactly when
 * {@link #status()} is terminal.
 *
 * @param id              execution id (UUID)
 * @param status          lifecycle status
 * @param workflowId      definition this execution runs
 * @param input           caller-supplied input (topic, keywords, ...)
 * @param createdAt       when the execution was accepted
 * @param startedAt       when a worker claimed it (nullable)
 * @param completedAt     when it reached a terminal status (nullable)
 * @param retryCount      total retries consumed across phases
 * @param result          final output, set on completion (nullable)
 * @param error           structured failure detail (nullable)
 * @param currentPhase    phase currently executing or last executed (nullable)
 * @param completedPhases number of phases with a terminal result
 * @param totalPhases     number of phases in the definition
 * @param phaseResults    per-phase results in execution order
 * @param tags            free-form labels copied from the definition
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
    String id,
    TaskStatus status,
    String workflowId,
    Map<String, Object> input,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    int retryCount,
    Map<String, Object> result,
    TaskError error,
    String currentPhase,
    int completedPhases,
    int totalPhases,
    Map<String, PhaseResult> phaseResults,
    List<String> tags
) implements Serializable {

    public Task {
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        phaseResults = phaseResults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(phaseResults));
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /** Creates a freshly accepted execution in {@link TaskStatus#PENDING}. */
    public static Task pending(String id, String workflowId, Map<String, Object> input,
                               int totalPhases, List<String> tags, Instant createdAt) {
        return new Task(id, TaskStatus.PENDING, workflowId, input, createdAt, null, null,
                0, null, null, null, 0, totalPhases, Map.of(), tags);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public int progressPercent() {
        if (status == TaskStatus.COMPLETED) {
            return 100;
        }
        if (totalPhases <= 0) {
            return 0;
        }
        return Math.min(100, completedPhases * 100 / totalPhases);
    }

    public Task withProgress(String phase, Map<String, PhaseResult> results, int retries) {
        return new Task(id, status, workflowId, input, createdAt, startedAt, completedAt,
                retries, result, error, phase, results.size(), totalPhases, results, tags);
    }
}
