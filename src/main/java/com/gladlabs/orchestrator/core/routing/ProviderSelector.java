package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.model.Capability;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders the providers of one priority tier by weighted score.
 * <p>
 * {@code score = successRate*w1 + capabilityMatch*w2 + 1/(1+latencyWeight)*w3 + 1/(1+costWeight)*w4},
 * highest first, ties broken by provider id. The ordering depends only on its arguments.
 */
public class ProviderSelector {

    private final RoutingWeights weights;

    public ProviderSelector(RoutingWeights weights) {
        this.weights = weights;
    }

    public double score(ModelProfile profile, Capability capability, ProviderStatistics.Stats stats) {
        double capabilityMatch = profile.supports(capability) ? 1.0 : 0.0;
        double inverseLatency = 1.0 / (1.0 + Math.max(0, profile.latencyWeight()));
        double inverseCost = 1.0 / (1.0 + Math.max(0, profile.costWeight()));
        return stats.successRate() * weights.successRate()
                + capabilityMatch * weights.capabilityMatch()
                + inverseLatency * weights.latency()
                + inverseCost * weights.cost();
    }

    public List<ModelProfile> order(List<ModelProfile> tier, Capability capability,
                                    Map<String, ProviderStatistics.Stats> stats) {
        Comparator<ModelProfile> byScore = Comparator.comparingDouble(
                (ModelProfile p) -> score(p, capability, stats.getOrDefault(p.providerId(), ProviderStatistics.Stats.EMPTY)))
                .reversed();
        return tier.stream()
                .sorted(byScore.thenComparing(ModelProfile::providerId))
                .toList();
    }
}
