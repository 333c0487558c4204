package com.gladlabs.orchestrator.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow execution and provider routing.
 */
@Service
public class OrchestratorMetrics {

    private final MeterRegistry registry;

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecutionResult(String status) {
        Counter.builder("orchestrator.executions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordExecutionDuration(long ms) {
        Timer.builder("orchestrator.execution.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPhaseExecution(String phase, String outcome, long ms) {
        Timer.builder("orchestrator.phase.duration")
                .tag("phase", phase)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one failed phase attempt.
     *
     * @param phase  phase name
     * @param reason error kind label (PhaseTimeout, QualityGateFailure, ...)
     */
    public void recordAttemptFailure(String phase, String reason) {
        Counter.builder("orchestrator.phase.attempt_failures")
                .description("Failed phase attempts by reason")
                .tag("phase", phase)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordQualityScore(String phase, double score) {
        DistributionSummary.builder("orchestrator.quality.score")
                .tag("phase", phase)
                .register(registry)
                .record(score);
    }

    public void recordRefineIterations(int iterations) {
        DistributionSummary.builder("orchestrator.refine.iterations")
                .register(registry)
                .record(iterations);
    }

    // --- Provider routing ---

    public void recordProviderCall(String providerId, boolean success, long ms) {
        Timer.builder("orchestrator.provider.latency")
                .tag("provider", providerId)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records the estimated USD cost of a provider call, derived from the model catalog prices.
     */
    public void recordProviderCost(String providerId, double usd) {
        DistributionSummary.builder("orchestrator.provider.cost")
                .description("Estimated provider call cost in USD")
                .baseUnit("usd")
                .tag("provider", providerId)
                .register(registry)
                .record(usd);
    }

    public void recordFallback(String fromProvider, String reason) {
        Counter.builder("orchestrator.provider.fallbacks")
                .description("Fallbacks to the next provider in the chain")
                .tag("from", fromProvider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
