package com.gladlabs.orchestrator.core.routing;

/**
 * Weights of the provider score factors. They need not sum to one.
 */
public record RoutingWeights(double successRate, double capabilityMatch, double latency, double cost) {

    public static RoutingWeights defaults() {
        return new RoutingWeights(0.4, 0.3, 0.15, 0.15);
    }
}
