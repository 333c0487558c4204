package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Terminal outcome of running one phase.
 *
 * @param phaseName    phase this result belongs to
 * @param status       succeeded, failed or skipped
 * @param output       accepted output (text or structured), nullable on failure
 * @param qualityScore score of the accepted output in [0,1] when a gate or QA phase scored it
 * @param attempts     attempts consumed, including the successful one
 * @param durationMs   wall time across all attempts
 * @param error        last failure, present unless the phase succeeded
 * @param providerId   provider that produced the accepted output
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhaseResult(
    @JsonProperty("phase_name") String phaseName,
    PhaseStatus status,
    Object output,
    @JsonProperty("quality_score") Double qualityScore,
    int attempts,
    @JsonProperty("duration_ms") long durationMs,
    TaskError error,
    @JsonProperty("provider_id") String providerId
) implements Serializable {

    public static PhaseResult succeeded(String phaseName, Object output, Double qualityScore,
                                        int attempts, long durationMs, String providerId) {
        return new PhaseResult(phaseName, PhaseStatus.SUCCEEDED, output, qualityScore,
                attempts, durationMs, null, providerId);
    }

    public static PhaseResult failed(String phaseName, TaskError error, int attempts, long durationMs) {
        return new PhaseResult(phaseName, PhaseStatus.FAILED, null, null, attempts, durationMs, error, null);
    }

    public static PhaseResult skipped(String phaseName, TaskError error, int attempts, long durationMs) {
        return new PhaseResult(phaseName, PhaseStatus.SKIPPED, null, null, attempts, durationMs, error, null);
    }

    public boolean succeeded() {
        return status == PhaseStatus.SUCCEEDED;
    }
}
