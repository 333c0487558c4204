package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Audit row for a single phase attempt, keyed by (executionId, phaseName, attemptNumber).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhaseAttemptRecord(
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("phase_name") String phaseName,
    @JsonProperty("attempt_number") int attemptNumber,
    PhaseStatus status,
    @JsonProperty("provider_id") String providerId,
    @JsonProperty("quality_score") Double qualityScore,
    @JsonProperty("error_kind") ErrorKind errorKind,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("recorded_at") Instant recordedAt
) implements Serializable {

    public boolean succeeded() {
        return status == PhaseStatus.SUCCEEDED;
    }
}
