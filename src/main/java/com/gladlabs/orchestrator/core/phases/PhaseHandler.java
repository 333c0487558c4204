package com.gladlabs.orchestrator.core.phases;

import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowContext;
import com.gladlabs.orchestrator.core.routing.GenerationOutput;
import com.gladlabs.orchestrator.core.routing.GenerationRequest;

/**
 * Turns workflow state into a prompt for one capability and interprets the reply.
 * <p>
 * {@link #buildRequest} runs on the worker thread and may read the context;
 * {@link #interpret} runs on the provider-call thread and must not touch it.
 */
public interface PhaseHandler {

    Capability capability();

    GenerationRequest buildRequest(PhaseConfig phase, WorkflowContext context);

    /**
     * Converts raw provider text into the phase output. Throwing fails the attempt.
     */
    Object interpret(PhaseConfig phase, GenerationOutput output);

    /** Whether a successful result becomes the content carried to later phases. */
    default boolean producesContent() {
        return false;
    }
}
