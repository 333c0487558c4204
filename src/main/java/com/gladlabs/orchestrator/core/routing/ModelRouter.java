package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.events.EventBus;
import com.gladlabs.orchestrator.core.events.OrchestrationEvent;
import com.gladlabs.orchestrator.core.metrics.OrchestratorMetrics;
import com.gladlabs.orchestrator.core.model.Capability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Chooses a live provider for a request and invokes it, falling back along the
 * configured priority chain.
 * <p>
 * Tiers are walked in priority order; inside a tier providers are ordered by
 * {@link ProviderSelector}. Each candidate is checked against the liveness cache before
 * it is called. The router never touches task or workflow state; it only publishes
 * {@code provider.selected} and {@code provider.failed} events.
 */
@Service
public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);

    private final ProviderRegistry registry;
    private final FallbackChains chains;
    private final ProviderSelector selector;
    private final ProviderLivenessCache liveness;
    private final ProviderStatistics statistics;
    private final TokenBudget tokenBudget;
    private final EventBus eventBus;
    private final OrchestratorMetrics metrics;
    private final Clock clock;

    public ModelRouter(ProviderRegistry registry, FallbackChains chains, ProviderSelector selector,
                       ProviderLivenessCache liveness, ProviderStatistics statistics, TokenBudget tokenBudget,
                       EventBus eventBus, OrchestratorMetrics metrics, Clock clock) {
        this.registry = registry;
        this.chains = chains;
        this.selector = selector;
        this.liveness = liveness;
        this.statistics = statistics;
        this.tokenBudget = tokenBudget;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ProviderHandle select(String taskType, Capability capability) {
        return select(taskType, capability, List.of());
    }

    /**
     * Returns the highest-priority live provider for the task type. When nothing is live
     * but some candidates are only down after a failed call, those are checked again in
     * priority order.
     *
     * @throws NoProviderAvailableException when no provider in the chain is live
     */
    public ProviderHandle select(String taskType, Capability capability, List<String> chainOverride) {
        List<ProviderHandle> downAfterFailure = new ArrayList<>();
        for (ModelProfile profile : candidates(taskType, capability, chainOverride)) {
            ProviderHandle handle = registry.find(profile.providerId()).orElseThrow();
            if (liveness.isLive(handle.provider())) {
                return handle;
            }
            if (liveness.isDownAfterFailure(handle.providerId())) {
                downAfterFailure.add(handle);
            }
        }
        for (ProviderHandle handle : downAfterFailure) {
            if (liveness.recheck(handle.provider())) {
                return handle;
            }
        }
        throw new NoProviderAvailableException("No live provider for task type '" + taskType + "'");
    }

    /**
     * Ordered candidate list: tiers in priority order, each tier sorted by score.
     * Pure over the current statistics snapshot; liveness is not consulted.
     * <p>
     * Providers that do not list the requested capability stay in the list. Capabilities
     * mark what a provider serves well, so a mismatch only lowers the score inside its tier
     * and such a provider remains a last resort for its tier.
     */
    public List<ModelProfile> candidates(String taskType, Capability capability, List<String> chainOverride) {
        Map<String, ProviderStatistics.Stats> snapshot = statistics.snapshot();
        List<ModelProfile> ordered = new ArrayList<>();
        for (List<String> tier : chains.resolve(taskType, capability, chainOverride, registry)) {
            List<ModelProfile> profiles = tier.stream()
                    .map(id -> registry.find(id).orElseThrow().profile())
                    .toList();
            ordered.addAll(selector.order(profiles, capability, snapshot));
        }
        return ordered;
    }

    /**
     * Invokes one provider. A failure is recorded in the statistics and marks the
     * provider down in the liveness cache.
     *
     * @throws ProviderFailureException when the call fails or returns no content
     */
    public GenerationOutput generate(ProviderHandle handle, GenerationRequest request) {
        GenerationRequest budgeted = tokenBudget.apply(request);
        String providerId = handle.providerId();
        long start = clock.millis();
        try {
            GenerationOutput output = handle.provider().generate(budgeted);
            if (output == null || output.text() == null || output.text().isBlank()) {
                throw new EmptyGenerationException(providerId, "Provider " + providerId + " returned empty content");
            }
            long elapsed = clock.millis() - start;
            statistics.recordSuccess(providerId, elapsed);
            metrics.recordProviderCall(providerId, true, elapsed);
            metrics.recordProviderCost(providerId, ModelCatalog.estimateCostUsd(
                    handle.profile().model(), budgeted.estimatedPromptTokens(), output.estimatedTokens()));
            return output;
        } catch (ProviderFailureException e) {
            onFailure(handle, request, start, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            onFailure(handle, request, start, e.getMessage());
            throw new ProviderFailureException(providerId, "Provider " + providerId + " failed: " + e.getMessage(), e);
        }
    }

    public GenerationOutput route(GenerationRequest request, List<String> chainOverride) {
        return route(request, chainOverride, new AttemptTrace());
    }

    /**
     * Walks the fallback chain until a provider succeeds. Candidates that are down only
     * because an earlier call failed get a fresh probe once no other candidate was live,
     * so a retry can reach a provider again after a transient outage.
     *
     * @throws NoProviderAvailableException when no candidate was live
     * @throws ChainExhaustedException      when every live candidate failed
     */
    public GenerationOutput route(GenerationRequest request, List<String> chainOverride, AttemptTrace trace) {
        List<ChainExhaustedException.ProviderFailure> failures = new ArrayList<>();
        List<ProviderHandle> downAfterFailure = new ArrayList<>();
        boolean anyInvoked = false;
        for (ModelProfile profile : candidates(request.taskType(), request.capability(), chainOverride)) {
            checkAbandoned(trace, profile.providerId());
            ProviderHandle handle = registry.find(profile.providerId()).orElseThrow();
            if (!liveness.isLive(handle.provider())) {
                if (liveness.isDownAfterFailure(handle.providerId())) {
                    downAfterFailure.add(handle);
                }
                failures.add(new ChainExhaustedException.ProviderFailure(profile.providerId(), "unavailable"));
                continue;
            }
            anyInvoked = true;
            GenerationOutput output = invoke(handle, request, trace, failures);
            if (output != null) {
                return output;
            }
        }
        if (!anyInvoked) {
            for (ProviderHandle handle : downAfterFailure) {
                checkAbandoned(trace, handle.providerId());
                if (!liveness.recheck(handle.provider())) {
                    continue;
                }
                log.info("Provider {} answered a fresh probe after its last failure; retrying it", handle.providerId());
                anyInvoked = true;
                failures.removeIf(f -> f.providerId().equals(handle.providerId()));
                GenerationOutput output = invoke(handle, request, trace, failures);
                if (output != null) {
                    return output;
                }
            }
        }
        if (!anyInvoked) {
            throw new NoProviderAvailableException("No live provider for task type '" + request.taskType()
                    + "' (candidates: " + failures.stream().map(ChainExhaustedException.ProviderFailure::providerId).toList() + ")");
        }
        throw new ChainExhaustedException(request.taskType(), failures);
    }

    private GenerationOutput invoke(ProviderHandle handle, GenerationRequest request, AttemptTrace trace,
                                    List<ChainExhaustedException.ProviderFailure> failures) {
        ModelProfile profile = handle.profile();
        trace.setCurrentProvider(profile.providerId());
        eventBus.publish(OrchestrationEvent.of("provider.selected", request.executionId(), request.phaseName(),
                Map.of("providerId", profile.providerId(), "model", String.valueOf(profile.model()),
                        "taskType", String.valueOf(request.taskType()))));
        log.debug("Routing {} to provider {}", request.taskType(), profile.providerId());
        try {
            return generate(handle, request);
        } catch (ProviderFailureException e) {
            failures.add(new ChainExhaustedException.ProviderFailure(profile.providerId(), e.getMessage()));
            metrics.recordFallback(profile.providerId(), "failure");
            return null;
        }
    }

    private static void checkAbandoned(AttemptTrace trace, String providerId) {
        if (trace.isAbandoned()) {
            throw new ProviderFailureException(providerId, "Attempt abandoned before calling " + providerId);
        }
    }

    /**
     * Called by the executor when an attempt on this provider exceeded its timeout.
     */
    public void reportTimeout(String providerId, GenerationRequest request) {
        if (providerId == null) {
            return;
        }
        statistics.recordFailure(providerId, 0);
        liveness.markDown(providerId, "timed out");
        eventBus.publish(OrchestrationEvent.of("provider.failed", request.executionId(), request.phaseName(),
                Map.of("providerId", providerId, "reason", "timeout")));
        metrics.recordFallback(providerId, "timeout");
    }

    /**
     * Describes every registered provider in registration order.
     *
     * @param probe refresh stale liveness entries first
     */
    public List<ProviderOverview> describeProviders(boolean probe) {
        if (probe) {
            registry.handles().forEach(h -> liveness.isLive(h.provider()));
        }
        Map<String, ProviderLivenessCache.Entry> live = liveness.snapshot();
        List<ProviderOverview> overview = new ArrayList<>();
        for (ModelProfile profile : registry.profiles()) {
            ProviderLivenessCache.Entry entry = live.get(profile.providerId());
            ProviderStatistics.Stats stats = statistics.get(profile.providerId());
            String price = profile.isLocal() ? "Free (local)"
                    : ModelCatalog.findModel(profile.model()).map(ModelCatalog.ModelInfo::priceDisplay).orElse(null);
            overview.add(new ProviderOverview(profile.providerId(), profile.model(), profile.baseUrl(),
                    profile.isLocal(), profile.capabilities(), profile.costWeight(), profile.latencyWeight(), price,
                    entry == null ? null : entry.live(),
                    entry == null ? null : entry.checkedAt(),
                    entry == null ? null : entry.reason(),
                    stats.successes(), stats.failures(), stats.successRate(), stats.lastLatencyMs()));
        }
        return overview;
    }

    public ProviderRegistry registry() {
        return registry;
    }

    public ProviderLivenessCache liveness() {
        return liveness;
    }

    public ProviderStatistics statistics() {
        return statistics;
    }

    private void onFailure(ProviderHandle handle, GenerationRequest request, long start, String reason) {
        String providerId = handle.providerId();
        long elapsed = clock.millis() - start;
        log.warn("Provider {} failed for {}: {}", providerId, request.taskType(), reason);
        statistics.recordFailure(providerId, elapsed);
        liveness.markDown(providerId, reason == null ? "failure" : reason);
        metrics.recordProviderCall(providerId, false, elapsed);
        eventBus.publish(OrchestrationEvent.of("provider.failed", request.executionId(), request.phaseName(),
                Map.of("providerId", providerId, "reason", reason == null ? "failure" : reason)));
    }
}
