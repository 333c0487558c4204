package com.gladlabs.orchestrator.core.workflow;

import java.util.List;

/**
 * Outcome of validating a workflow definition. Warnings never make it invalid.
 */
public record ValidationReport(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationReport of(List<String> errors, List<String> warnings) {
        return new ValidationReport(errors.isEmpty(), errors, warnings);
    }
}
