package com.gladlabs.orchestrator.core.routing;

/**
 * Per-call generation limits.
 *
 * @param maxTokens   output token budget, null lets the router apply the task-type default
 * @param temperature sampling temperature, null keeps the provider default
 */
public record GenerationConstraints(Integer maxTokens, Double temperature) {

    public static GenerationConstraints defaults() {
        return new GenerationConstraints(null, null);
    }

    public GenerationConstraints withMaxTokens(Integer value) {
        return new GenerationConstraints(value, temperature);
    }
}
