package com.gladlabs.orchestrator.core.engine;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.PhaseAttemptRecord;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.PhaseResult;
import com.gladlabs.orchestrator.core.model.PhaseStatus;
import com.gladlabs.orchestrator.core.model.WorkflowContext;
import com.gladlabs.orchestrator.core.quality.QualityAssessment;
import com.gladlabs.orchestrator.support.EngineHarness;
import com.gladlabs.orchestrator.support.ScriptedProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

class PhaseExecutorTest {

    private EngineHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    private static WorkflowContext context() {
        return new WorkflowContext("wf", "exec-1", Map.of("topic", "Observability"), List.of());
    }

    private static ExecutionControl control(Duration workflowTimeout) {
        ExecutionControl control = new ExecutionControl("exec-1", workflowTimeout, Clock.systemUTC());
        control.start();
        return control;
    }

    private static PhaseConfig phase(String name, String agent, int timeoutSeconds, int maxRetries) {
        return PhaseConfig.of(name, agent).withTimeoutSeconds(timeoutSeconds).withMaxRetries(maxRetries);
    }

    @Nested
    @DisplayName("Attempts and retries")
    class Attempts {

        @Test
        @DisplayName("a successful first attempt records one succeeded attempt row")
        void firstAttemptSucceeds() {
            ScriptedProvider local = ScriptedProvider.replying("local", "Research notes");
            harness = new EngineHarness(local);

            PhaseResult result = harness.phaseExecutor.run(phase("research", "research", 30, 2), context(),
                    control(Duration.ofMinutes(1)));

            assertEquals(PhaseStatus.SUCCEEDED, result.status());
            assertEquals("Research notes", result.output());
            assertEquals(1, result.attempts());
            assertEquals("local", result.providerId());
            List<PhaseAttemptRecord> rows = harness.store.attempts("exec-1");
            assertEquals(1, rows.size());
            assertEquals(PhaseStatus.SUCCEEDED, rows.get(0).status());
            assertTrue(harness.eventTypes().contains("phase.completed"));
        }

        @Test
        @DisplayName("max_retries=2 makes exactly three attempts before failing")
        void retriesExhausted() {
            ScriptedProvider flaky = new ScriptedProvider("flaky").fail("down").fail("down").fail("down");
            harness = new EngineHarness(flaky);

            PhaseResult result = harness.phaseExecutor.run(phase("draft", "content", 30, 2), context(),
                    control(Duration.ofMinutes(1)));

            assertEquals(PhaseStatus.FAILED, result.status());
            assertEquals(3, result.attempts());
            assertEquals(3, result.error().attempts());
            assertEquals("draft", result.error().phaseName());
            List<PhaseAttemptRecord> rows = harness.store.attempts("exec-1");
            assertEquals(List.of(1, 2, 3), rows.stream().map(PhaseAttemptRecord::attemptNumber).toList());
            assertTrue(rows.stream().allMatch(r -> r.status() == PhaseStatus.FAILED));
            assertEquals(3.0, harness.meterRegistry.find("orchestrator.phase.attempt_failures")
                    .counters().stream().mapToDouble(c -> c.count()).sum());
            assertEquals(3, flaky.calls());
        }

        @Test
        @DisplayName("a single-provider chain recovers on the next attempt after a failure")
        void recoversOnRetry() {
            ScriptedProvider only = new ScriptedProvider("only").fail("429 Too Many Requests").respond("draft text");
            harness = new EngineHarness(only);

            PhaseResult result = harness.phaseExecutor.run(phase("draft", "content", 30, 2), context(),
                    control(Duration.ofMinutes(1)));

            assertEquals(PhaseStatus.SUCCEEDED, result.status());
            assertEquals("draft text", result.output());
            assertEquals(2, result.attempts());
            assertEquals(2, only.calls());
            assertEquals(ErrorKind.CHAIN_EXHAUSTED, harness.store.attempts("exec-1").get(0).errorKind());
            assertTrue(harness.eventTypes().contains("phase.attempt_failed"));
            assertTrue(harness.liveness.snapshot().get("only").live());
        }

        @Test
        @DisplayName("a provider that is still unreachable is not called again")
        void unreachableProviderStaysDown() {
            ScriptedProvider only = new ScriptedProvider("only");
            only.otherwise(r -> {
                only.live(false);
                throw new IllegalStateException("connection refused");
            });
            harness = new EngineHarness(only);

            PhaseResult result = harness.phaseExecutor.run(phase("draft", "content", 30, 2), context(),
                    control(Duration.ofMinutes(1)));

            assertEquals(PhaseStatus.FAILED, result.status());
            assertEquals(3, result.attempts());
            assertEquals(1, only.calls());
            assertEquals(ErrorKind.NO_PROVIDER_AVAILABLE, result.error().kind());
        }
    }

    @Nested
    @DisplayName("Quality gate")
    class QualityGate {

        @Test
        @DisplayName("a score below the threshold fails the attempt and triggers a retry")
        void belowThresholdRetries() {
            harness = new EngineHarness(ScriptedProvider.replying("local", "Draft text"));
            BlockingQueue<Double> scores = new ArrayBlockingQueue<>(4, false, List.of(0.5, 0.9));
            harness.scoreWith(request -> new QualityAssessment(scores.remove(), "", List.of()));

            PhaseResult result = harness.phaseExecutor.run(
                    phase("draft", "content", 30, 2).withQualityThreshold(0.8), context(),
                    control(Duration.ofMinutes(1)));

            assertEquals(PhaseStatus.SUCCEEDED, result.status());
            assertEquals(2, result.attempts());
            assertEquals(0.9, result.qualityScore(), 1e-9);
            PhaseAttemptRecord first = harness.store.attempts("exec-1").get(0);
            assertEquals(ErrorKind.QUALITY_GATE_FAILURE, first.errorKind());
            assertEquals(0.5, first.qualityScore(), 1e-9);
            assertEquals(1.0, harness.counter("orchestrator.phase.attempt_failures",
                    "phase", "draft", "reason", "QualityGateFailure"));
        }

        @Test
        @DisplayName("when every attempt misses the gate the best-scored output is kept")
        void keepsBestOutput() {
            ScriptedProvider writer = new ScriptedProvider("writer").respond("v1").respond("v2").respond("v3");
            harness = new EngineHarness(writer);
            harness.scoreWith(request -> new QualityAssessment(
                    request.content().equals("v2") ? 0.6 : 0.3, "", List.of()));

            PhaseResult result = harness.phaseExecutor.run(
                    phase("draft", "content", 30, 2).withQualityThreshold(0.9), context(),
                    control(Duration.ofMinutes(1)));

            assertEquals(PhaseStatus.FAILED, result.status());
            assertEquals(ErrorKind.QUALITY_GATE_FAILURE, result.error().kind());
            assertEquals("v2", result.output());
            assertEquals(0.6, result.qualityScore(), 1e-9);
        }

        @Test
        @DisplayName("phases without a threshold are not scored")
        void noThresholdNoScore() {
            harness = new EngineHarness(ScriptedProvider.replying("local", "text"));
            harness.scoreWith(request -> {
                throw new AssertionError("scorer must not be called");
            });

            PhaseResult result = harness.phaseExecutor.run(phase("draft", "content", 30, 0), context(),
                    control(Duration.ofMinutes(1)));

            assertTrue(result.succeeded());
            assertNull(result.qualityScore());
        }

        @Test
        @DisplayName("a QA phase takes its score from its own assessment")
        void qaPhaseScoresItself() {
            harness = new EngineHarness(ScriptedProvider.replying("local",
                    "{\"score\": 0.7, \"feedback\": \"needs examples\", \"suggestions\": [\"add code\"]}"));

            PhaseResult result = harness.phaseExecutor.run(phase("assess", "qa", 30, 0), context(),
                    control(Duration.ofMinutes(1)));

            assertTrue(result.succeeded());
            assertEquals(0.7, result.qualityScore(), 1e-9);
            assertInstanceOf(QualityAssessment.class, result.output());
        }
    }

    @Nested
    @DisplayName("Timeouts and failure policy")
    class Timeouts {

        @Test
        @DisplayName("a hung primary times out and the retry falls through to the backup")
        void timeoutThenRecovery() {
            ScriptedProvider primary = new ScriptedProvider("primary").hang(Duration.ofSeconds(5), "too late");
            ScriptedProvider backup = ScriptedProvider.replying("backup", "backup draft");
            harness = new EngineHarness(primary, backup);

            PhaseResult result = harness.phaseExecutor.run(phase("draft", "content", 1, 1), context(),
                    control(Duration.ofMinutes(1)));

            assertEquals(PhaseStatus.SUCCEEDED, result.status());
            assertEquals(2, result.attempts());
            assertEquals("backup", result.providerId());
            PhaseAttemptRecord first = harness.store.attempts("exec-1").get(0);
            assertEquals(ErrorKind.PHASE_TIMEOUT, first.errorKind());
            assertFalse(harness.liveness.snapshot().get("primary").live());
        }

        @Test
        @DisplayName("a timeout bounded by the workflow budget raises WorkflowTimeout")
        void workflowBudgetExceeded() {
            ScriptedProvider slow = new ScriptedProvider("slow").hang(Duration.ofSeconds(5), "late");
            harness = new EngineHarness(slow);

            assertThrows(WorkflowTimeoutException.class, () -> harness.phaseExecutor.run(
                    phase("draft", "content", 30, 2), context(), control(Duration.ofMillis(500))));
        }

        @Test
        @DisplayName("an optional phase with skip_on_error ends skipped")
        void skipOnError() {
            harness = new EngineHarness(new ScriptedProvider("broken").otherwise(r -> {
                throw new IllegalStateException("no images today");
            }));

            PhaseResult result = harness.phaseExecutor.run(
                    phase("image", "image", 30, 0).withPolicy(true, false), context(),
                    control(Duration.ofMinutes(1)));

            assertEquals(PhaseStatus.SKIPPED, result.status());
            assertEquals(ErrorKind.CHAIN_EXHAUSTED, result.error().kind());
            assertTrue(harness.eventTypes().contains("phase.skipped"));
        }

        @Test
        @DisplayName("skip_on_error has no effect on a required phase")
        void requiredNeverSkips() {
            harness = new EngineHarness(new ScriptedProvider("broken").live(false));

            PhaseResult result = harness.phaseExecutor.run(
                    phase("draft", "content", 30, 0).withPolicy(true, true), context(),
                    control(Duration.ofMinutes(1)));

            assertEquals(PhaseStatus.FAILED, result.status());
            assertEquals(ErrorKind.NO_PROVIDER_AVAILABLE, result.error().kind());
            assertTrue(harness.eventTypes().contains("phase.failed"));
        }

        @Test
        @DisplayName("a cancel request stops the phase before the next retry")
        void cancelBetweenAttempts() {
            ScriptedProvider broken = new ScriptedProvider("broken").otherwise(r -> {
                throw new IllegalStateException("down");
            });
            harness = new EngineHarness(broken);
            ExecutionControl control = control(Duration.ofMinutes(1));
            control.requestCancel();

            PhaseResult result = harness.phaseExecutor.run(phase("draft", "content", 30, 5), context(), control);

            assertEquals(1, result.attempts());
            assertEquals(ErrorKind.CANCELLED, result.error().kind());
            assertEquals(1, broken.calls());
        }
    }
}
