package com.gladlabs.orchestrator.core.workflow;

import com.gladlabs.orchestrator.core.model.PhaseConfig;

import java.util.List;

/**
 * Executable form of a validated definition, with catalog defaults applied.
 */
public record WorkflowPlan(String workflowId, List<PlanStep> steps, List<String> tags) {

    public WorkflowPlan {
        steps = List.copyOf(steps);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public List<PhaseConfig> phases() {
        return steps.stream().flatMap(s -> s.phases().stream()).toList();
    }

    public int totalPhases() {
        return phases().size();
    }
}
