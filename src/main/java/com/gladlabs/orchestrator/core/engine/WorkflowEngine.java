package com.gladlabs.orchestrator.core.engine;

import com.gladlabs.orchestrator.core.config.OrchestratorProperties;
import com.gladlabs.orchestrator.core.events.EventBus;
import com.gladlabs.orchestrator.core.events.OrchestrationEvent;
import com.gladlabs.orchestrator.core.logging.MdcContext;
import com.gladlabs.orchestrator.core.metrics.OrchestratorMetrics;
import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.InvalidTransitionException;
import com.gladlabs.orchestrator.core.model.OrchestrationException;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.PhaseResult;
import com.gladlabs.orchestrator.core.model.PhaseStatus;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskError;
import com.gladlabs.orchestrator.core.model.TaskStateMachine;
import com.gladlabs.orchestrator.core.model.WorkflowContext;
import com.gladlabs.orchestrator.core.persistence.TaskStore;
import com.gladlabs.orchestrator.core.phases.PhaseHandlerRegistry;
import com.gladlabs.orchestrator.core.quality.QualityAssessment;
import com.gladlabs.orchestrator.core.workflow.PlanStep;
import com.gladlabs.orchestrator.core.workflow.WorkflowPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drives one execution through its plan on the calling worker thread and owns every
 * status transition of the task after it is claimed.
 * <p>
 * Phases run strictly in plan order. Cancellation and the workflow deadline are checked
 * between phases; {@link PhaseExecutor} checks them between attempts. A failed required
 * phase ends the run, a failed optional phase does not. An assess/refine pair runs as a
 * bounded loop whose iteration count is kept on the {@link WorkflowContext}.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final PhaseExecutor phaseExecutor;
    private final PhaseHandlerRegistry handlers;
    private final TaskStore taskStore;
    private final EventBus eventBus;
    private final OrchestratorMetrics metrics;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public WorkflowEngine(PhaseExecutor phaseExecutor, PhaseHandlerRegistry handlers, TaskStore taskStore,
                          EventBus eventBus, OrchestratorMetrics metrics, OrchestratorProperties properties,
                          Clock clock) {
        this.phaseExecutor = phaseExecutor;
        this.handlers = handlers;
        this.taskStore = taskStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /** Raised inside the run when a step ends the execution early. */
    private static final class StopExecution extends RuntimeException {
        private final TaskError error;

        StopExecution(TaskError error) {
            super(error == null ? "cancelled" : error.message(), null, false, false);
            this.error = error;
        }
    }

    /**
     * Claims the pending task and runs the plan to a terminal status.
     *
     * @return the stored task after the run; if the task could not be claimed, its current state
     */
    public Task execute(String executionId, WorkflowPlan plan, ExecutionControl control) {
        MdcContext.setExecution(executionId);
        try {
            var claimed = taskStore.claim(executionId, clock.instant());
            if (claimed.isEmpty()) {
                log.info("Execution {} was not pending; skipping run", executionId);
                return taskStore.find(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
            }
            control.start();
            Task task = claimed.get();
            long start = clock.millis();
            eventBus.publish(OrchestrationEvent.of("execution.started", executionId, null,
                    Map.of("workflowId", plan.workflowId(), "totalPhases", plan.totalPhases())));
            log.info("Execution {} started: workflow {} with {} phase(s)", executionId, plan.workflowId(),
                    plan.totalPhases());

            WorkflowContext context = new WorkflowContext(plan.workflowId(), executionId, task.input(), plan.tags());
            Task finished = run(task, plan, context, control);

            long duration = clock.millis() - start;
            metrics.recordExecutionResult(finished.status().value());
            metrics.recordExecutionDuration(duration);
            log.info("Execution {} finished as {} in {}ms", executionId, finished.status().value(), duration);
            return finished;
        } finally {
            MdcContext.clear();
        }
    }

    private Task run(Task task, WorkflowPlan plan, WorkflowContext context, ExecutionControl control) {
        try {
            int index = 0;
            for (PlanStep step : plan.steps()) {
                checkpoint(control);
                if (step instanceof PlanStep.RefineLoopStep loop) {
                    task = runRefineLoop(task, loop, index, context, control);
                } else if (step instanceof PlanStep.PhaseStep single) {
                    task = runPhase(task, single.phase(), index, context, control, true);
                }
                index += step.phases().size();
            }
            checkpoint(control);
            return complete(task, context);
        } catch (StopExecution stop) {
            return finish(task, context, stop.error);
        } catch (WorkflowTimeoutException e) {
            log.warn("Execution {} timed out: {}", context.executionId(), e.getMessage());
            return finish(task, context, TaskError.of(ErrorKind.WORKFLOW_TIMEOUT, e.getMessage()));
        } catch (InvalidTransitionException e) {
            log.warn("Execution {} was finalized elsewhere: {}", context.executionId(), e.getMessage());
            return taskStore.find(context.executionId()).orElse(task);
        } catch (OrchestrationException e) {
            log.error("Execution {} failed: {}", context.executionId(), e.getMessage(), e);
            return finish(task, context, e.toTaskError());
        } catch (RuntimeException e) {
            log.error("Execution {} failed with unexpected error", context.executionId(), e);
            return finish(task, context, TaskError.of(ErrorKind.INTERNAL,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }

    /**
     * Runs one phase, records its result and persists progress.
     *
     * @param applyPolicy when true, a failed required phase stops the execution here
     */
    private Task runPhase(Task task, PhaseConfig phase, int index, WorkflowContext context,
                          ExecutionControl control, boolean applyPolicy) {
        context.setCurrentPhaseIndex(index);
        PhaseResult result = phaseExecutor.run(phase, context, control);
        context.recordResult(result);
        if (result.succeeded() && handlers.handlerFor(Capability.require(phase.agent())).producesContent()) {
            context.setLatestOutput(result.output());
        }
        task = taskStore.update(task.withProgress(phase.name(), context.phaseResults(), context.totalRetries()));

        if (control.isCancelRequested()) {
            throw new StopExecution(null);
        }
        if (applyPolicy) {
            applyFailurePolicy(phase, result);
        }
        return task;
    }

    private void applyFailurePolicy(PhaseConfig phase, PhaseResult result) {
        if (result.succeeded()) {
            return;
        }
        if (phase.isRequired() && result.status() != PhaseStatus.SKIPPED) {
            TaskError cause = result.error();
            String detail = cause == null ? "" : " (" + cause.kind().label() + ": " + cause.message() + ")";
            throw new StopExecution(new TaskError(ErrorKind.REQUIRED_PHASE_FAILED,
                    "Required phase '" + phase.name() + "' failed" + detail, phase.name(), result.attempts()));
        }
        log.info("Optional phase {} ended {}; continuing", phase.name(), result.status().value());
    }

    private Task runRefineLoop(Task task, PlanStep.RefineLoopStep loop, int index, WorkflowContext context,
                               ExecutionControl control) {
        PhaseConfig assess = loop.assess().withoutQualityGate();
        PhaseConfig refine = loop.refine().withoutQualityGate();
        double threshold = refineThreshold(loop);
        int maxIterations = Math.max(0, properties.getEngine().getMaxRefineIterations());

        Object bestDraft = context.latestOutput();
        double bestScore = -1.0;
        try {
            while (true) {
                task = runPhase(task, assess, index, context, control, false);
                PhaseResult assessed = context.resultOf(assess.name()).orElseThrow();
                if (!assessed.succeeded()) {
                    applyFailurePolicy(assess, assessed);
                    break;
                }
                double score = assessed.qualityScore() == null ? 0.0 : assessed.qualityScore();
                if (score > bestScore) {
                    bestScore = score;
                    bestDraft = context.latestOutput();
                }
                if (score >= threshold) {
                    log.info("Draft accepted with score {} (threshold {}) after {} refinement(s)",
                            score, threshold, context.refineIterations());
                    break;
                }
                if (context.refineIterations() >= maxIterations) {
                    log.info("Refine cap of {} reached; continuing with best draft (score {})",
                            maxIterations, bestScore);
                    break;
                }
                checkpoint(control);

                if (assessed.output() instanceof QualityAssessment critique) {
                    context.putVariable(WorkflowContext.FEEDBACK, critique.feedback());
                    context.putVariable(WorkflowContext.SUGGESTIONS, critique.suggestions());
                }
                int iteration = context.incrementRefineIterations();
                log.info("Refining draft (iteration {}/{}, score {} < {})", iteration, maxIterations, score, threshold);
                try {
                    task = runPhase(task, refine, index + 1, context, control, false);
                } finally {
                    context.removeVariable(WorkflowContext.FEEDBACK);
                    context.removeVariable(WorkflowContext.SUGGESTIONS);
                }
                PhaseResult refined = context.resultOf(refine.name()).orElseThrow();
                if (!refined.succeeded()) {
                    applyFailurePolicy(refine, refined);
                    break;
                }
                checkpoint(control);
            }
        } finally {
            context.setLatestOutput(bestDraft);
            metrics.recordRefineIterations(context.refineIterations());
        }
        return task;
    }

    private double refineThreshold(PlanStep.RefineLoopStep loop) {
        if (loop.assess().qualityThreshold() != null) {
            return loop.assess().qualityThreshold();
        }
        if (loop.refine().qualityThreshold() != null) {
            return loop.refine().qualityThreshold();
        }
        return properties.getEngine().getDefaultQualityThreshold();
    }

    private static void checkpoint(ExecutionControl control) {
        if (control.isCancelRequested()) {
            throw new StopExecution(null);
        }
        control.checkDeadline();
    }

    private Task complete(Task task, WorkflowContext context) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("final_output", context.latestOutput() == null ? null : String.valueOf(context.latestOutput()));
        Map<String, String> phases = new LinkedHashMap<>();
        context.phaseResults().forEach((name, r) -> phases.put(name, r.status().value()));
        result.put("phases", phases);
        result.put("refine_iterations", context.refineIterations());
        Task completed = taskStore.update(TaskStateMachine.complete(current(task), result, clock.instant()));
        eventBus.publish(OrchestrationEvent.of("execution.completed", context.executionId(), null,
                Map.of("phases", phases.size(), "refineIterations", context.refineIterations())));
        return completed;
    }

    /**
     * Moves the task to failed, or to cancelled when {@code error} is null. A task already
     * finalized elsewhere is returned as stored.
     */
    private Task finish(Task task, WorkflowContext context, TaskError error) {
        try {
            return error == null ? cancel(task, context) : fail(task, context, error);
        } catch (InvalidTransitionException e) {
            log.warn("Execution {} was finalized elsewhere: {}", context.executionId(), e.getMessage());
            return taskStore.find(context.executionId()).orElse(task);
        }
    }

    private Task fail(Task task, WorkflowContext context, TaskError error) {
        Task failed = taskStore.update(TaskStateMachine.fail(current(task), error, clock.instant()));
        eventBus.publish(OrchestrationEvent.of("execution.failed", context.executionId(), error.phaseName(),
                Map.of("kind", error.kind().label(), "message", String.valueOf(error.message()))));
        log.warn("Execution {} failed ({}): {}", context.executionId(), error.kind().label(), error.message());
        return failed;
    }

    private Task cancel(Task task, WorkflowContext context) {
        Task cancelled = taskStore.update(TaskStateMachine.cancel(current(task), clock.instant()));
        eventBus.publish(OrchestrationEvent.of("execution.cancelled", context.executionId(), null, Map.of()));
        log.info("Execution {} cancelled after {} phase(s)", context.executionId(), context.phaseResults().size());
        return cancelled;
    }

    /** Latest persisted copy, so terminal writes keep the progress fields. */
    private Task current(Task task) {
        return taskStore.find(task.id()).orElse(task);
    }
}
