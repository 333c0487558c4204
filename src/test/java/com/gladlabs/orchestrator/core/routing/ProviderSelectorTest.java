package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.model.Capability;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProviderSelectorTest {

    private final ProviderSelector selector = new ProviderSelector(RoutingWeights.defaults());

    private static ModelProfile profile(String id, Set<Capability> caps, double cost, double latency) {
        return new ModelProfile(id, id + "-model", "http://" + id, caps, cost, latency, false);
    }

    @Test
    @DisplayName("score combines success rate, capability, latency and cost")
    void scoreFormula() {
        ModelProfile p = profile("a", Set.of(Capability.CONTENT), 1.0, 1.0);
        ProviderStatistics.Stats stats = new ProviderStatistics.Stats(9, 0, 100);

        double expected = stats.successRate() * 0.4 + 1.0 * 0.3 + 0.5 * 0.15 + 0.5 * 0.15;
        assertEquals(expected, selector.score(p, Capability.CONTENT, stats), 1e-9);
    }

    @Test
    @DisplayName("capable provider ranks above an incapable one with equal stats")
    void capabilityWins() {
        ModelProfile generic = profile("generic", Set.of(), 0.0, 0.0);
        ModelProfile writer = profile("writer", Set.of(Capability.CONTENT), 0.0, 0.0);

        List<ModelProfile> ordered = selector.order(List.of(generic, writer), Capability.CONTENT, Map.of());

        assertEquals(List.of("writer", "generic"), ordered.stream().map(ModelProfile::providerId).toList());
    }

    @Test
    @DisplayName("a provider with a poor track record drops below a reliable one")
    void successRateMatters() {
        ModelProfile flaky = profile("flaky", Set.of(Capability.CONTENT), 0.0, 0.0);
        ModelProfile steady = profile("steady", Set.of(Capability.CONTENT), 0.0, 0.0);
        Map<String, ProviderStatistics.Stats> stats = Map.of(
                "flaky", new ProviderStatistics.Stats(1, 9, 50),
                "steady", new ProviderStatistics.Stats(9, 1, 50));

        List<ModelProfile> ordered = selector.order(List.of(flaky, steady), Capability.CONTENT, stats);

        assertEquals("steady", ordered.get(0).providerId());
    }

    @Test
    @DisplayName("equal scores are ordered by provider id so the result is deterministic")
    void tiesBrokenById() {
        ModelProfile b = profile("b", Set.of(), 0.0, 0.0);
        ModelProfile a = profile("a", Set.of(), 0.0, 0.0);

        List<ModelProfile> ordered = selector.order(List.of(b, a), Capability.RESEARCH, Map.of());

        assertEquals(List.of("a", "b"), ordered.stream().map(ModelProfile::providerId).toList());
    }

    @Test
    @DisplayName("unseen providers use a neutral smoothed success rate")
    void emptyStatsAreNeutral() {
        assertEquals(0.5, ProviderStatistics.Stats.EMPTY.successRate(), 1e-9);
    }
}
