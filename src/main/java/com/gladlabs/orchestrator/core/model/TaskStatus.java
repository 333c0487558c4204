package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Externally observable lifecycle status of an orchestrated {@link Task}.
 * <p>
 * {@code PENDING → PROCESSING → {COMPLETED | FAILED | CANCELLED}}. Terminal states
 * never transition again; {@code PROCESSING → PROCESSING} records phase progress.
 */
public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public Set<TaskStatus> validTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING);
            case PROCESSING -> EnumSet.of(PROCESSING, COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus next) {
        return validTargets().contains(next);
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
