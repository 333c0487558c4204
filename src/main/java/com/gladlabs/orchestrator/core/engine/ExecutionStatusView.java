package com.gladlabs.orchestrator.core.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gladlabs.orchestrator.core.model.PhaseResult;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskError;
import com.gladlabs.orchestrator.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Caller-facing snapshot of an execution. Failures appear as {@link TaskError}, never as traces.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionStatusView(
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("workflow_id") String workflowId,
    TaskStatus status,
    @JsonProperty("current_phase") String currentPhase,
    @JsonProperty("phase_results") Map<String, PhaseResult> phaseResults,
    @JsonProperty("progress_percent") int progressPercent,
    @JsonProperty("retry_count") int retryCount,
    TaskError error,
    Map<String, Object> result,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    List<String> tags
) {

    public static ExecutionStatusView from(Task task) {
        return new ExecutionStatusView(task.id(), task.workflowId(), task.status(), task.currentPhase(),
                task.phaseResults(), task.progressPercent(), task.retryCount(), task.error(), task.result(),
                task.createdAt(), task.startedAt(), task.completedAt(), task.tags());
    }
}
