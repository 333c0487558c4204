package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Failure taxonomy surfaced in {@link TaskError#kind()} and attempt audit records.
 */
public enum ErrorKind {
    PROVIDER_FAILURE("ProviderFailure"),
    CHAIN_EXHAUSTED("ChainExhausted"),
    NO_PROVIDER_AVAILABLE("NoProviderAvailable"),
    PHASE_TIMEOUT("PhaseTimeout"),
    QUALITY_GATE_FAILURE("QualityGateFailure"),
    VALIDATION_FAILURE("ValidationFailure"),
    WORKFLOW_TIMEOUT("WorkflowTimeout"),
    REQUIRED_PHASE_FAILED("RequiredPhaseFailed"),
    CANCELLED("Cancelled"),
    INTERNAL("Internal");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ErrorKind fromLabel(String label) {
        return Arrays.stream(values())
                .filter(k -> k.label.equalsIgnoreCase(label) || k.name().equalsIgnoreCase(label))
                .findFirst()
                .orElse(INTERNAL);
    }
}
