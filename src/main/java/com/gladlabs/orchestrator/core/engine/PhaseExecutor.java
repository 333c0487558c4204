package com.gladlabs.orchestrator.core.engine;

import com.gladlabs.orchestrator.core.events.EventBus;
import com.gladlabs.orchestrator.core.events.OrchestrationEvent;
import com.gladlabs.orchestrator.core.logging.MdcContext;
import com.gladlabs.orchestrator.core.metrics.OrchestratorMetrics;
import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;
import com.gladlabs.orchestrator.core.model.PhaseAttemptRecord;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.PhaseResult;
import com.gladlabs.orchestrator.core.model.PhaseStatus;
import com.gladlabs.orchestrator.core.model.TaskError;
import com.gladlabs.orchestrator.core.model.WorkflowContext;
import com.gladlabs.orchestrator.core.persistence.TaskStore;
import com.gladlabs.orchestrator.core.phases.PhaseHandler;
import com.gladlabs.orchestrator.core.phases.PhaseHandlerRegistry;
import com.gladlabs.orchestrator.core.quality.QualityAssessment;
import com.gladlabs.orchestrator.core.quality.QualityRequest;
import com.gladlabs.orchestrator.core.quality.QualityScorer;
import com.gladlabs.orchestrator.core.routing.AttemptTrace;
import com.gladlabs.orchestrator.core.routing.GenerationOutput;
import com.gladlabs.orchestrator.core.routing.GenerationRequest;
import com.gladlabs.orchestrator.core.routing.ModelRouter;
import com.gladlabs.orchestrator.core.workflow.AvailablePhaseCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one phase to a terminal {@link PhaseResult}: routes each attempt through the
 * {@link ModelRouter}, bounds it with the phase timeout, applies the quality gate and
 * retries with backoff.
 * <p>
 * Attempt failures never escape; only {@link WorkflowTimeoutException} does, when the
 * workflow deadline passes mid-phase. Every attempt is written to the task store.
 */
@Service
public class PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private final ModelRouter router;
    private final PhaseHandlerRegistry handlers;
    private final QualityScorer qualityScorer;
    private final TaskStore taskStore;
    private final EventBus eventBus;
    private final OrchestratorMetrics metrics;
    private final RetryBackoff backoff;
    private final ExecutorService providerCalls;
    private final Clock clock;

    public PhaseExecutor(ModelRouter router, PhaseHandlerRegistry handlers, QualityScorer qualityScorer,
                         TaskStore taskStore, EventBus eventBus, OrchestratorMetrics metrics, RetryBackoff backoff,
                         @Qualifier("providerCallExecutor") ExecutorService providerCalls, Clock clock) {
        this.router = router;
        this.handlers = handlers;
        this.qualityScorer = qualityScorer;
        this.taskStore = taskStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.backoff = backoff;
        this.providerCalls = providerCalls;
        this.clock = clock;
    }

    /** Accepted output of one attempt, before the quality gate is applied. */
    private record AttemptOutput(String providerId, Object value, Double score) {}

    /** What one attempt produced: an accepted output or a failure with any partial output. */
    private record AttemptOutcome(AttemptOutput output, TaskError error) {
        boolean succeeded() {
            return error == null;
        }
    }

    public PhaseResult run(PhaseConfig phase, WorkflowContext context, ExecutionControl control) {
        Capability capability = Capability.require(phase.agent());
        PhaseHandler handler = handlers.handlerFor(capability);
        int maxAttempts = Math.max(0, phase.maxRetries() == null ? 0 : phase.maxRetries()) + 1;
        long phaseStart = clock.millis();

        MdcContext.setPhase(context.executionId(), phase.name(), phase.agent());
        eventBus.publish(OrchestrationEvent.of("phase.started", context.executionId(), phase.name(),
                Map.of("agent", phase.agent(), "maxAttempts", maxAttempts)));
        log.info("Phase {} started (agent={}, timeout={}s, maxAttempts={})",
                phase.name(), phase.agent(), phase.timeoutSeconds(), maxAttempts);

        TaskError lastError = null;
        AttemptOutput best = null;
        int attempts = 0;
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (attempt > 1) {
                    if (control.isCancelRequested()) {
                        return cancelled(phase, attempts, phaseStart);
                    }
                    Duration delay = backoff.delayFor(attempt - 1);
                    log.info("Retrying phase {} in {}ms (attempt {}/{})", phase.name(), delay.toMillis(),
                            attempt, maxAttempts);
                    control.sleep(delay);
                    if (control.isCancelRequested()) {
                        return cancelled(phase, attempts, phaseStart);
                    }
                }
                control.checkDeadline();

                attempts++;
                if (attempt > 1) {
                    context.recordRetry(phase.name());
                }
                int attemptNumber = context.nextAttemptNumber(phase.name());
                long attemptStart = clock.millis();
                AttemptOutcome outcome = attempt(phase, handler, context, control);
                long attemptMs = clock.millis() - attemptStart;
                record(context, phase, attemptNumber, outcome, attemptMs);

                if (outcome.succeeded()) {
                    AttemptOutput output = outcome.output();
                    long duration = clock.millis() - phaseStart;
                    metrics.recordPhaseExecution(phase.name(), "succeeded", duration);
                    if (output.score() != null) {
                        metrics.recordQualityScore(phase.name(), output.score());
                    }
                    eventBus.publish(OrchestrationEvent.of("phase.completed", context.executionId(), phase.name(),
                            payload("attempts", attempts, "providerId", output.providerId(), "score", output.score())));
                    log.info("Phase {} succeeded after {} attempt(s) via {}", phase.name(), attempts, output.providerId());
                    return PhaseResult.succeeded(phase.name(), output.value(), output.score(), attempts, duration,
                            output.providerId());
                }

                lastError = outcome.error();
                metrics.recordAttemptFailure(phase.name(), lastError.kind().label());
                eventBus.publish(OrchestrationEvent.of("phase.attempt_failed", context.executionId(), phase.name(),
                        payload("attempt", attempt, "kind", lastError.kind().label(), "message", lastError.message())));
                log.warn("Phase {} attempt {}/{} failed ({}): {}", phase.name(), attempt, maxAttempts,
                        lastError.kind().label(), lastError.message());
                if (isBetter(outcome.output(), best)) {
                    best = outcome.output();
                }
            }
        } finally {
            MdcContext.clearPhase();
        }
        return exhausted(phase, context, lastError, best, attempts, phaseStart);
    }

    private AttemptOutcome attempt(PhaseConfig phase, PhaseHandler handler, WorkflowContext context,
                                   ExecutionControl control) {
        GenerationRequest request = handler.buildRequest(phase, context);
        AttemptTrace trace = new AttemptTrace();
        Map<String, Object> input = context.initialInput();
        Double threshold = phase.qualityThreshold();

        CompletableFuture<AttemptOutput> future = CompletableFuture.supplyAsync(MdcContext.wrapSupplier(() -> {
            GenerationOutput generated = router.route(request, phase.providerChain(), trace);
            Object value = handler.interpret(phase, generated);
            Double score = null;
            if (value instanceof QualityAssessment assessment) {
                score = assessment.score();
            } else if (threshold != null) {
                score = qualityScorer.assess(new QualityRequest(context.executionId(), phase.name(),
                        String.valueOf(value), input)).score();
            }
            return new AttemptOutput(generated.providerId(), value, score);
        }), providerCalls);

        int timeoutSeconds = phase.timeoutSeconds() == null
                ? AvailablePhaseCatalog.DEFAULT_TIMEOUT_SECONDS : phase.timeoutSeconds();
        Duration phaseTimeout = Duration.ofSeconds(timeoutSeconds);
        Duration timeout = control.boundedTimeout(phaseTimeout);
        boolean boundByWorkflow = timeout.compareTo(phaseTimeout) < 0;
        try {
            AttemptOutput output = future.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (threshold != null && output.score() != null && output.score() < threshold) {
                return new AttemptOutcome(output, new TaskError(ErrorKind.QUALITY_GATE_FAILURE,
                        String.format("Quality score %.2f below threshold %.2f", output.score(), threshold),
                        phase.name(), null));
            }
            return new AttemptOutcome(output, null);
        } catch (TimeoutException e) {
            trace.abandon();
            router.reportTimeout(trace.currentProvider(), request);
            if (boundByWorkflow || control.isPastDeadline()) {
                throw new WorkflowTimeoutException("Execution " + context.executionId()
                        + " exceeded its workflow timeout during phase '" + phase.name() + "'");
            }
            return new AttemptOutcome(null, new TaskError(ErrorKind.PHASE_TIMEOUT,
                    "Attempt exceeded " + timeout.toSeconds() + "s"
                            + (trace.currentProvider() == null ? "" : " on provider " + trace.currentProvider()),
                    phase.name(), null));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            ErrorKind kind = cause instanceof OrchestrationException oe ? oe.kind() : ErrorKind.PROVIDER_FAILURE;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            if (!(cause instanceof OrchestrationException)) {
                log.warn("Phase {} attempt failed with unexpected {}", phase.name(), cause.getClass().getName(), cause);
            }
            return new AttemptOutcome(null, new TaskError(kind, message, phase.name(), null));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            trace.abandon();
            control.requestCancel();
            return new AttemptOutcome(null, new TaskError(ErrorKind.CANCELLED,
                    "Worker interrupted during attempt", phase.name(), null));
        }
    }

    private PhaseResult exhausted(PhaseConfig phase, WorkflowContext context, TaskError lastError,
                                  AttemptOutput best, int attempts, long phaseStart) {
        long duration = clock.millis() - phaseStart;
        TaskError error = lastError == null
                ? new TaskError(ErrorKind.INTERNAL, "Phase made no attempts", phase.name(), attempts)
                : lastError.forPhase(phase.name(), attempts);
        boolean skip = phase.isSkipOnError() && !phase.isRequired();
        PhaseStatus status = skip ? PhaseStatus.SKIPPED : PhaseStatus.FAILED;
        metrics.recordPhaseExecution(phase.name(), status.value(), duration);
        eventBus.publish(OrchestrationEvent.of(skip ? "phase.skipped" : "phase.failed", context.executionId(),
                phase.name(), payload("attempts", attempts, "kind", error.kind().label(), "message", error.message())));
        log.warn("Phase {} {} after {} attempt(s): {}", phase.name(), status.value(), attempts, error.message());
        return new PhaseResult(phase.name(), status,
                best == null ? null : best.value(),
                best == null ? null : best.score(),
                attempts, duration, error,
                best == null ? null : best.providerId());
    }

    private PhaseResult cancelled(PhaseConfig phase, int attempts, long phaseStart) {
        log.info("Phase {} stopped after {} attempt(s): cancellation requested", phase.name(), attempts);
        return PhaseResult.failed(phase.name(),
                new TaskError(ErrorKind.CANCELLED, "Execution cancelled", phase.name(), attempts),
                attempts, clock.millis() - phaseStart);
    }

    private void record(WorkflowContext context, PhaseConfig phase, int attemptNumber, AttemptOutcome outcome,
                        long durationMs) {
        AttemptOutput output = outcome.output();
        TaskError error = outcome.error();
        taskStore.recordAttempt(new PhaseAttemptRecord(
                context.executionId(),
                phase.name(),
                attemptNumber,
                outcome.succeeded() ? PhaseStatus.SUCCEEDED : PhaseStatus.FAILED,
                output == null ? null : output.providerId(),
                output == null ? null : output.score(),
                error == null ? null : error.kind(),
                error == null ? null : error.message(),
                durationMs,
                clock.instant()));
    }

    private static boolean isBetter(AttemptOutput candidate, AttemptOutput best) {
        if (candidate == null || candidate.score() == null) {
            return false;
        }
        return best == null || best.score() == null || candidate.score() > best.score();
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}
