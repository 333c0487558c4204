package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Terminal outcome of one phase within an execution.
 */
public enum PhaseStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PhaseStatus fromValue(String value) {
        return PhaseStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
