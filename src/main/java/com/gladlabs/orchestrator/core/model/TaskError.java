package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Structured failure detail attached to a failed {@link Task} or {@link PhaseResult}.
 * Callers receive this instead of an exception or stack trace.
 *
 * @param kind      failure category
 * @param message   human-readable summary
 * @param phaseName phase that failed (nullable for workflow-level failures)
 * @param attempts  attempts consumed by the failing phase (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskError(
    ErrorKind kind,
    String message,
    @JsonProperty("phase_name") String phaseName,
    Integer attempts
) implements Serializable {

    public static TaskError of(ErrorKind kind, String message) {
        return new TaskError(kind, message, null, null);
    }

    public TaskError forPhase(String phase, int attemptCount) {
        return new TaskError(kind, message, phase, attemptCount);
    }
}
