package com.gladlabs.orchestrator.core.routing;

/**
 * A language-model endpoint the router can call.
 * <p>
 * Implementations must be thread-safe; calls arrive concurrently from the provider-call pool.
 */
public interface GenerationProvider {

    /** Provider id, matching {@link ModelProfile#providerId()}. */
    String id();

    /**
     * Lightweight reachability check. Returning false or throwing both count as down.
     */
    boolean probe();

    /**
     * Runs one generation. Failures surface as {@link ProviderFailureException} or any
     * other unchecked exception, which the router wraps.
     */
    GenerationOutput generate(GenerationRequest request);
}
