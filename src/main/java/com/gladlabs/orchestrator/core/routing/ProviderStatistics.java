package com.gladlabs.orchestrator.core.routing;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running success/failure counts per provider, feeding the success-rate routing factor.
 */
public class ProviderStatistics {

    /**
     * Immutable counters for one provider.
     */
    public record Stats(long successes, long failures, long lastLatencyMs) {

        static final Stats EMPTY = new Stats(0, 0, 0);

        /** Laplace-smoothed success rate, 0.5 for a provider never called. */
        public double successRate() {
            return (successes + 1.0) / (successes + failures + 2.0);
        }

        public long calls() {
            return successes + failures;
        }
    }

    private final ConcurrentHashMap<String, Stats> stats = new ConcurrentHashMap<>();

    public void recordSuccess(String providerId, long latencyMs) {
        stats.merge(providerId, new Stats(1, 0, latencyMs),
                (old, inc) -> new Stats(old.successes() + 1, old.failures(), latencyMs));
    }

    public void recordFailure(String providerId, long latencyMs) {
        stats.merge(providerId, new Stats(0, 1, latencyMs),
                (old, inc) -> new Stats(old.successes(), old.failures() + 1, latencyMs));
    }

    public Stats get(String providerId) {
        return stats.getOrDefault(providerId, Stats.EMPTY);
    }

    public Map<String, Stats> snapshot() {
        return Map.copyOf(stats);
    }
}
