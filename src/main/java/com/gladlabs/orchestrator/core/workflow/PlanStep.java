package com.gladlabs.orchestrator.core.workflow;

import com.gladlabs.orchestrator.core.model.PhaseConfig;

import java.util.List;

/**
 * One step of a {@link WorkflowPlan}: a single phase or an assess/refine loop.
 */
public interface PlanStep {

    /** Phases this step may run, in definition order. */
    List<PhaseConfig> phases();

    /**
     * Runs one phase.
     */
    record PhaseStep(PhaseConfig phase) implements PlanStep {
        @Override
        public List<PhaseConfig> phases() {
            return List.of(phase);
        }
    }

    /**
     * Self-critique loop: {@code assess} scores the draft; below threshold, {@code refine}
     * rewrites it with the critique and {@code assess} runs again.
     */
    record RefineLoopStep(PhaseConfig assess, PhaseConfig refine) implements PlanStep {
        @Override
        public List<PhaseConfig> phases() {
            return List.of(assess, refine);
        }
    }
}
