package com.gladlabs.orchestrator.core.engine;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.PhaseStatus;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskStatus;
import com.gladlabs.orchestrator.core.model.WorkflowDefinition;
import com.gladlabs.orchestrator.core.routing.GenerationRequest;
import com.gladlabs.orchestrator.core.workflow.WorkflowPlan;
import com.gladlabs.orchestrator.support.EngineHarness;
import com.gladlabs.orchestrator.support.ScriptedProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowEngineTest {

    private static final String EXEC = "exec-42";

    private EngineHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    private static PhaseConfig phase(String name, String agent) {
        return PhaseConfig.of(name, agent).withTimeoutSeconds(30).withMaxRetries(0);
    }

    private static WorkflowDefinition workflow(PhaseConfig... phases) {
        return new WorkflowDefinition("wf-test", "Test workflow", "engine test", List.of(phases), null, false,
                List.of("test"));
    }

    /** Responds per phase name; refine calls are numbered r1, r2, ... */
    private static Function<GenerationRequest, String> responder(Function<String, Double> scoreForDraft) {
        AtomicInteger refines = new AtomicInteger();
        return request -> switch (request.phaseName()) {
            case "research" -> "Key facts about the topic";
            case "draft" -> "v1";
            case "refine" -> "r" + refines.incrementAndGet();
            case "assess" -> {
                String prompt = request.userPrompt();
                String draft = prompt.substring(prompt.lastIndexOf("Draft:\n") + 7).trim();
                yield "{\"score\": " + scoreForDraft.apply(draft) + ", \"feedback\": \"Add examples\","
                        + " \"suggestions\": [\"Show code\"]}";
            }
            case "publish" -> "{\"title\": \"Final\", \"slug\": \"final\"}";
            default -> "output of " + request.phaseName();
        };
    }

    private Task run(WorkflowDefinition definition) {
        return run(definition, new ExecutionControl(EXEC, harness.properties.getEngine().getWorkflowTimeout(),
                harness.clock));
    }

    private Task run(WorkflowDefinition definition, ExecutionControl control) {
        WorkflowPlan plan = harness.adapter.buildPlan(definition);
        harness.store.create(Task.pending(EXEC, definition.id(), Map.of("topic", "Java records"),
                plan.totalPhases(), definition.tags(), Instant.now()));
        return harness.engine.execute(EXEC, plan, control);
    }

    @Nested
    @DisplayName("Sequential execution")
    class Sequential {

        @Test
        @DisplayName("all phases succeed and the task completes with the final draft")
        void happyPath() {
            harness = new EngineHarness(new ScriptedProvider("local").otherwise(responder(d -> 0.9)));

            Task task = run(workflow(phase("research", "research"), phase("draft", "content"),
                    phase("assess", "qa").withQualityThreshold(0.75), phase("refine", "content"),
                    phase("publish", "publish")));

            assertEquals(TaskStatus.COMPLETED, task.status());
            assertEquals("v1", task.result().get("final_output"));
            assertEquals(0, task.result().get("refine_iterations"));
            assertEquals(100, task.progressPercent());
            assertEquals(List.of("research", "draft", "assess", "publish"), List.copyOf(task.phaseResults().keySet()));
            assertNotNull(task.startedAt());
            assertNotNull(task.completedAt());
            List<String> types = harness.eventTypes();
            assertEquals("execution.started", types.get(0));
            assertEquals("execution.completed", types.get(types.size() - 1));
            assertEquals(1.0, harness.counter("orchestrator.executions.total", "status", "completed"));
        }

        @Test
        @DisplayName("a failed required phase stops the run and later phases never start")
        void requiredPhaseShortCircuits() {
            ScriptedProvider local = new ScriptedProvider("local").otherwise(request -> {
                if (request.phaseName().equals("draft")) {
                    throw new IllegalStateException("model crashed");
                }
                return "notes";
            });
            harness = new EngineHarness(local);

            Task task = run(workflow(phase("research", "research"), phase("draft", "content"),
                    phase("publish", "publish")));

            assertEquals(TaskStatus.FAILED, task.status());
            assertEquals(ErrorKind.REQUIRED_PHASE_FAILED, task.error().kind());
            assertEquals("draft", task.error().phaseName());
            assertTrue(task.error().message().contains("ChainExhausted"));
            assertFalse(task.phaseResults().containsKey("publish"));
            assertTrue(local.requests().stream().noneMatch(r -> r.phaseName().equals("publish")));
            assertTrue(harness.eventTypes().contains("execution.failed"));
        }

        @Test
        @DisplayName("a skipped optional phase lets the run continue")
        void skipContinues() {
            ScriptedProvider local = new ScriptedProvider("local").otherwise(responder(d -> 0.9));
            ScriptedProvider imager = new ScriptedProvider("imager").otherwise(request -> {
                throw new IllegalStateException("image model offline");
            });
            harness = new EngineHarness(local, imager);

            Task task = run(workflow(phase("draft", "content"), phase("image", "image").withPolicy(true, false)
                    .withProviderChain(List.of("imager")), phase("publish", "publish")));

            assertEquals(TaskStatus.COMPLETED, task.status());
            assertEquals(PhaseStatus.SKIPPED, task.phaseResults().get("image").status());
            assertEquals(PhaseStatus.SUCCEEDED, task.phaseResults().get("publish").status());
            @SuppressWarnings("unchecked")
            Map<String, String> phases = (Map<String, String>) task.result().get("phases");
            assertEquals("skipped", phases.get("image"));
        }

        @Test
        @DisplayName("an optional phase without skip_on_error fails but does not stop the run")
        void optionalFailureContinues() {
            ScriptedProvider local = ScriptedProvider.replying("local", "text");
            ScriptedProvider search = new ScriptedProvider("search").otherwise(request -> {
                throw new IllegalStateException("search down");
            });
            harness = new EngineHarness(local, search);

            Task task = run(workflow(phase("research", "research").withPolicy(false, false)
                    .withProviderChain(List.of("search")),
                    phase("draft", "content")));

            assertEquals(TaskStatus.COMPLETED, task.status());
            assertEquals(PhaseStatus.FAILED, task.phaseResults().get("research").status());
            assertEquals("text", task.result().get("final_output"));
        }

        @Test
        @DisplayName("a task that is no longer pending is returned without running")
        void notPendingIsNotRun() {
            ScriptedProvider local = ScriptedProvider.replying("local", "text");
            harness = new EngineHarness(local);
            WorkflowDefinition definition = workflow(phase("draft", "content"));
            WorkflowPlan plan = harness.adapter.buildPlan(definition);
            harness.store.create(Task.pending(EXEC, definition.id(), Map.of(), 1, List.of(), Instant.now()));
            harness.store.claim(EXEC, Instant.now());

            Task task = harness.engine.execute(EXEC, plan,
                    new ExecutionControl(EXEC, Duration.ofMinutes(1), Clock.systemUTC()));

            assertEquals(TaskStatus.PROCESSING, task.status());
            assertEquals(0, local.calls());
        }
    }

    @Nested
    @DisplayName("Refine loop")
    class RefineLoop {

        @Test
        @DisplayName("refines until the assessment meets the threshold")
        void refinesUntilAccepted() {
            ScriptedProvider local = new ScriptedProvider("local")
                    .otherwise(responder(draft -> draft.equals("r1") ? 0.8 : 0.4));
            harness = new EngineHarness(local);

            Task task = run(workflow(phase("draft", "content"), phase("assess", "qa").withQualityThreshold(0.75),
                    phase("refine", "content")));

            assertEquals(TaskStatus.COMPLETED, task.status());
            assertEquals("r1", task.result().get("final_output"));
            assertEquals(1, task.result().get("refine_iterations"));
            GenerationRequest refine = local.requests().stream()
                    .filter(r -> r.phaseName().equals("refine")).findFirst().orElseThrow();
            assertTrue(refine.userPrompt().contains("Critique:\nAdd examples"));
            assertTrue(refine.userPrompt().contains("- Show code"));
            assertTrue(refine.userPrompt().endsWith("Draft:\nv1"));
        }

        @Test
        @DisplayName("stops at the iteration cap and keeps the best-scored draft")
        void capKeepsBestDraft() {
            Map<String, Double> scores = Map.of("v1", 0.5, "r1", 0.7, "r2", 0.6);
            ScriptedProvider local = new ScriptedProvider("local").otherwise(responder(scores::get));
            harness = new EngineHarness(local);
            harness.properties.getEngine().setMaxRefineIterations(2);

            Task task = run(workflow(phase("draft", "content"), phase("assess", "qa").withQualityThreshold(0.9),
                    phase("refine", "content")));

            assertEquals(TaskStatus.COMPLETED, task.status());
            assertEquals("r1", task.result().get("final_output"));
            assertEquals(2, task.result().get("refine_iterations"));
            assertEquals(2, local.requests().stream().filter(r -> r.phaseName().equals("refine")).count());
            assertEquals(3, harness.store.attempts(EXEC).stream()
                    .filter(a -> a.phaseName().equals("assess")).count());
        }

        @Test
        @DisplayName("retries from every refine iteration count toward the task retry total")
        void retriesAcrossIterationsAreCounted() {
            Function<GenerationRequest, String> base = responder(d -> 0.5);
            AtomicInteger refineCalls = new AtomicInteger();
            ScriptedProvider local = new ScriptedProvider("local").otherwise(request -> {
                if (request.phaseName().equals("refine") && refineCalls.incrementAndGet() % 2 == 1) {
                    throw new IllegalStateException("rate limited");
                }
                return base.apply(request);
            });
            harness = new EngineHarness(local);
            harness.properties.getEngine().setMaxRefineIterations(2);

            Task task = run(workflow(phase("draft", "content"), phase("assess", "qa").withQualityThreshold(0.9),
                    phase("refine", "content").withMaxRetries(1)));

            assertEquals(TaskStatus.COMPLETED, task.status());
            assertEquals(2, task.result().get("refine_iterations"));
            assertEquals(4, refineCalls.get());
            assertEquals(2, task.retryCount());
        }

        @Test
        @DisplayName("without a threshold on the pair the configured default applies")
        void defaultThreshold() {
            ScriptedProvider local = new ScriptedProvider("local").otherwise(responder(d -> 0.72));
            harness = new EngineHarness(local);
            harness.properties.getEngine().setDefaultQualityThreshold(0.7);

            Task task = run(workflow(phase("draft", "content"), phase("assess", "qa"), phase("refine", "content")));

            assertEquals(0, task.result().get("refine_iterations"));
        }
    }

    @Nested
    @DisplayName("Deadline and cancellation")
    class Interruptions {

        @Test
        @DisplayName("exceeding the workflow timeout fails the task with WorkflowTimeout")
        void workflowTimeout() {
            ScriptedProvider slow = new ScriptedProvider("slow").otherwise(request -> {
                ScriptedProvider.sleep(Duration.ofSeconds(3));
                return "late";
            });
            harness = new EngineHarness(slow);
            ExecutionControl control = new ExecutionControl(EXEC, Duration.ofMillis(700), Clock.systemUTC());

            Task task = run(workflow(phase("research", "research"), phase("draft", "content")), control);

            assertEquals(TaskStatus.FAILED, task.status());
            assertEquals(ErrorKind.WORKFLOW_TIMEOUT, task.error().kind());
            assertFalse(task.phaseResults().containsKey("draft"));
        }

        @Test
        @DisplayName("a cancel request during a phase ends the task cancelled after that phase")
        void cancelDuringPhase() {
            AtomicReference<ExecutionControl> control = new AtomicReference<>();
            ScriptedProvider local = new ScriptedProvider("local").otherwise(request -> {
                control.get().requestCancel();
                return "notes";
            });
            harness = new EngineHarness(local);
            control.set(new ExecutionControl(EXEC, Duration.ofMinutes(1), Clock.systemUTC()));

            Task task = run(workflow(phase("research", "research"), phase("draft", "content")), control.get());

            assertEquals(TaskStatus.CANCELLED, task.status());
            assertEquals(ErrorKind.CANCELLED, task.error().kind());
            assertTrue(task.phaseResults().containsKey("research"));
            assertEquals(1, local.calls());
            assertTrue(harness.eventTypes().contains("execution.cancelled"));
        }
    }
}
