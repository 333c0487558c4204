package com.gladlabs.orchestrator.core.engine;

import com.gladlabs.orchestrator.core.config.OrchestratorProperties;
import com.gladlabs.orchestrator.core.events.EventBus;
import com.gladlabs.orchestrator.core.events.OrchestrationEvent;
import com.gladlabs.orchestrator.core.logging.MdcContext;
import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.InvalidTransitionException;
import com.gladlabs.orchestrator.core.model.PhaseAttemptRecord;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskError;
import com.gladlabs.orchestrator.core.model.TaskStateMachine;
import com.gladlabs.orchestrator.core.model.TaskStatus;
import com.gladlabs.orchestrator.core.model.WorkflowDefinition;
import com.gladlabs.orchestrator.core.persistence.TaskStore;
import com.gladlabs.orchestrator.core.workflow.AvailablePhase;
import com.gladlabs.orchestrator.core.workflow.CustomWorkflowAdapter;
import com.gladlabs.orchestrator.core.workflow.ValidationReport;
import com.gladlabs.orchestrator.core.workflow.WorkflowDefinitionStore;
import com.gladlabs.orchestrator.core.workflow.WorkflowNotFoundException;
import com.gladlabs.orchestrator.core.workflow.WorkflowPlan;
import com.gladlabs.orchestrator.core.workflow.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for callers: accepts executions, reports their status and cancels them.
 * <p>
 * {@link #createExecution} validates synchronously and returns as soon as the pending task
 * is stored; a worker from the orchestration pool runs it. Each running or queued execution
 * has an {@link ExecutionControl} through which cancellation reaches the worker.
 */
@Service
public class ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final WorkflowDefinitionStore definitions;
    private final CustomWorkflowAdapter adapter;
    private final WorkflowEngine engine;
    private final TaskStore taskStore;
    private final EventBus eventBus;
    private final OrchestratorProperties properties;
    private final ExecutorService workers;
    private final Clock clock;
    private final ConcurrentHashMap<String, ExecutionControl> controls = new ConcurrentHashMap<>();

    public ExecutionService(WorkflowDefinitionStore definitions, CustomWorkflowAdapter adapter, WorkflowEngine engine,
                            TaskStore taskStore, EventBus eventBus, OrchestratorProperties properties,
                            @Qualifier("orchestrationExecutor") ExecutorService workers, Clock clock) {
        this.definitions = definitions;
        this.adapter = adapter;
        this.engine = engine;
        this.taskStore = taskStore;
        this.eventBus = eventBus;
        this.properties = properties;
        this.workers = workers;
        this.clock = clock;
    }

    /**
     * Validates the workflow and queues a new execution.
     *
     * @throws WorkflowNotFoundException   when no definition has this id
     * @throws WorkflowValidationException when the definition is invalid; no task is created
     */
    public ExecutionTicket createExecution(String workflowId, Map<String, Object> input) {
        WorkflowDefinition definition = definitions.find(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        WorkflowPlan plan = adapter.buildPlan(definition);

        String executionId = UUID.randomUUID().toString();
        taskStore.create(Task.pending(executionId, definition.id(), input, plan.totalPhases(),
                definition.tags(), clock.instant()));
        log.info("Accepted execution {} of workflow {}", executionId, workflowId);
        submit(executionId, plan);
        return new ExecutionTicket(executionId, TaskStatus.PENDING);
    }

    public ExecutionStatusView getExecutionStatus(String executionId) {
        return ExecutionStatusView.from(findTask(executionId));
    }

    public List<ExecutionStatusView> listExecutions(int limit) {
        return taskStore.list(Math.max(1, limit)).stream().map(ExecutionStatusView::from).toList();
    }

    public List<PhaseAttemptRecord> getAttempts(String executionId) {
        findTask(executionId);
        return taskStore.attempts(executionId);
    }

    /**
     * Requests cooperative cancellation. Repeating the request is harmless; completed and
     * failed executions are left as they are.
     */
    public CancelResult cancelExecution(String executionId) {
        Task task = findTask(executionId);
        if (task.status() == TaskStatus.CANCELLED) {
            return new CancelResult(TaskStatus.CANCELLED, true);
        }
        if (task.isTerminal()) {
            log.info("Cancel of execution {} ignored: already {}", executionId, task.status().value());
            return new CancelResult(task.status(), false);
        }

        ExecutionControl control = controls.get(executionId);
        if (control != null) {
            if (control.requestCancel()) {
                log.info("Cancellation requested for execution {}", executionId);
            }
            if (task.status() == TaskStatus.PENDING) {
                // still queued; finalize now instead of waiting for a worker
                cancelDirectly(executionId);
            }
            return new CancelResult(TaskStatus.CANCELLED, true);
        }

        log.info("Execution {} has no active worker; cancelling in the store", executionId);
        Task after = cancelDirectly(executionId);
        return new CancelResult(after.status(), after.status() == TaskStatus.CANCELLED);
    }

    public List<AvailablePhase> listAvailablePhases() {
        return adapter.listAvailablePhases();
    }

    public ValidationReport validateWorkflowDefinition(WorkflowDefinition definition) {
        return adapter.validate(definition);
    }

    /**
     * Validates and stores a custom definition.
     *
     * @throws WorkflowValidationException when the definition is invalid
     */
    public WorkflowDefinition registerWorkflow(WorkflowDefinition definition) {
        ValidationReport report = adapter.validate(definition);
        if (!report.valid()) {
            throw new WorkflowValidationException(report);
        }
        WorkflowDefinition saved = definitions.save(definition);
        log.info("Registered workflow {} ({}) with {} phase(s)", saved.id(), saved.name(), saved.phases().size());
        return saved;
    }

    /**
     * Validates and replaces a stored custom definition, keeping its id.
     *
     * @throws WorkflowValidationException when the definition is invalid
     * @throws WorkflowNotFoundException   when no definition has this id
     * @throws IllegalArgumentException    when the id belongs to a built-in template
     */
    public WorkflowDefinition updateWorkflow(String workflowId, WorkflowDefinition definition) {
        ValidationReport report = adapter.validate(definition);
        if (!report.valid()) {
            throw new WorkflowValidationException(report);
        }
        WorkflowDefinition updated = definitions.update(workflowId, definition)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        log.info("Updated workflow {} ({}) with {} phase(s)", workflowId, updated.name(), updated.phases().size());
        return updated;
    }

    /**
     * Deletes a custom definition. Executions already created keep running from their plan.
     *
     * @throws WorkflowNotFoundException when no definition has this id
     * @throws IllegalArgumentException  when the id belongs to a built-in template
     */
    public void deleteWorkflow(String workflowId) {
        if (!definitions.delete(workflowId)) {
            throw new WorkflowNotFoundException(workflowId);
        }
        log.info("Deleted workflow {}", workflowId);
    }

    public List<WorkflowDefinition> listWorkflows() {
        return definitions.list();
    }

    public Optional<WorkflowDefinition> findWorkflow(String workflowId) {
        return definitions.find(workflowId);
    }

    /**
     * Blocks until the execution reaches a terminal status or the timeout elapses.
     *
     * @return the last observed task
     */
    public Task awaitTerminal(String executionId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Task task = findTask(executionId);
        while (!task.isTerminal() && System.nanoTime() < deadline) {
            Thread.sleep(POLL_INTERVAL.toMillis());
            task = findTask(executionId);
        }
        return task;
    }

    public boolean isActive(String executionId) {
        return controls.containsKey(executionId);
    }

    /**
     * Settles tasks left behind by a previous process: processing tasks lost their worker and
     * fail; pending tasks are queued again when their workflow still exists.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverOrphans() {
        if (!properties.getEngine().isRecoverOrphans()) {
            return;
        }
        for (Task task : taskStore.findByStatus(TaskStatus.PROCESSING)) {
            if (controls.containsKey(task.id())) {
                continue;
            }
            try {
                taskStore.update(TaskStateMachine.fail(task,
                        TaskError.of(ErrorKind.INTERNAL, "Execution interrupted by restart"), clock.instant()));
                log.warn("Marked orphaned execution {} as failed", task.id());
            } catch (RuntimeException e) {
                log.warn("Could not settle orphaned execution {}: {}", task.id(), e.getMessage());
            }
        }
        for (Task task : taskStore.findByStatus(TaskStatus.PENDING)) {
            if (controls.containsKey(task.id())) {
                continue;
            }
            try {
                Optional<WorkflowDefinition> definition = definitions.find(task.workflowId());
                if (definition.isPresent()) {
                    log.info("Resubmitting pending execution {}", task.id());
                    submit(task.id(), adapter.buildPlan(definition.get()));
                } else {
                    Instant now = clock.instant();
                    taskStore.claim(task.id(), now).ifPresent(claimed -> taskStore.update(TaskStateMachine.fail(
                            claimed, new WorkflowNotFoundException(task.workflowId()).toTaskError(), now)));
                    log.warn("Pending execution {} references unknown workflow {}; failed", task.id(),
                            task.workflowId());
                }
            } catch (RuntimeException e) {
                log.warn("Could not recover pending execution {}: {}", task.id(), e.getMessage());
            }
        }
    }

    private void submit(String executionId, WorkflowPlan plan) {
        ExecutionControl control = new ExecutionControl(executionId, properties.getEngine().getWorkflowTimeout(), clock);
        controls.put(executionId, control);
        try {
            workers.execute(MdcContext.wrap(() -> {
                try {
                    engine.execute(executionId, plan, control);
                } catch (RuntimeException e) {
                    log.error("Worker failed while running execution {}", executionId, e);
                } finally {
                    controls.remove(executionId);
                }
            }));
        } catch (RejectedExecutionException e) {
            controls.remove(executionId);
            log.error("Orchestration pool rejected execution {}", executionId, e);
            Instant now = clock.instant();
            taskStore.claim(executionId, now).ifPresent(claimed -> taskStore.update(TaskStateMachine.fail(claimed,
                    TaskError.of(ErrorKind.INTERNAL, "Execution could not be scheduled"), now)));
        }
    }

    private Task cancelDirectly(String executionId) {
        Instant now = clock.instant();
        try {
            Task task = taskStore.claim(executionId, now).orElseGet(() -> findTask(executionId));
            if (task.isTerminal()) {
                return task;
            }
            Task cancelled = taskStore.update(TaskStateMachine.cancel(task, now));
            eventBus.publish(OrchestrationEvent.of("execution.cancelled", executionId, null, Map.of()));
            return cancelled;
        } catch (InvalidTransitionException e) {
            log.debug("Execution {} settled concurrently: {}", executionId, e.getMessage());
            return findTask(executionId);
        }
    }

    private Task findTask(String executionId) {
        return taskStore.find(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }
}
