package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.model.Capability;

/**
 * A single prompt to be routed to a provider.
 */
public record GenerationRequest(
    String executionId,
    String phaseName,
    String taskType,
    Capability capability,
    String systemPrompt,
    String userPrompt,
    GenerationConstraints constraints
) {

    public GenerationRequest {
        constraints = constraints == null ? GenerationConstraints.defaults() : constraints;
    }

    public GenerationRequest withConstraints(GenerationConstraints value) {
        return new GenerationRequest(executionId, phaseName, taskType, capability,
                systemPrompt, userPrompt, value);
    }

    /** Rough prompt size in tokens (four characters per token). */
    public int estimatedPromptTokens() {
        int chars = (systemPrompt == null ? 0 : systemPrompt.length())
                + (userPrompt == null ? 0 : userPrompt.length());
        return chars / 4;
    }
}
