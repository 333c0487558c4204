package com.gladlabs.orchestrator.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gladlabs.orchestrator.core.engine.ExecutionService;
import com.gladlabs.orchestrator.core.engine.ExecutionTicket;
import com.gladlabs.orchestrator.core.health.HealthCheckService;
import com.gladlabs.orchestrator.core.health.HealthStatus;
import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.PhaseResult;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskError;
import com.gladlabs.orchestrator.core.model.TaskStateMachine;
import com.gladlabs.orchestrator.core.model.TaskStatus;
import com.gladlabs.orchestrator.core.model.WorkflowDefinition;
import com.gladlabs.orchestrator.core.routing.ModelRouter;
import com.gladlabs.orchestrator.core.routing.ProviderOverview;
import com.gladlabs.orchestrator.core.workflow.AvailablePhase;
import com.gladlabs.orchestrator.core.workflow.ValidationReport;
import com.gladlabs.orchestrator.core.workflow.WorkflowNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private record CliResult(int exitCode, String output) {}

    private ExecutionService executionService;
    private HealthCheckService healthCheckService;
    private ModelRouter modelRouter;

    @BeforeEach
    void setUp() {
        executionService = mock(ExecutionService.class);
        healthCheckService = mock(HealthCheckService.class);
        modelRouter = mock(ModelRouter.class);
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(executionService);
                }
                if (cls == PhasesCommand.class) {
                    return (K) new PhasesCommand(executionService);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(executionService, new ObjectMapper());
                }
                if (cls == ProvidersCommand.class) {
                    return (K) new ProvidersCommand(modelRouter);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new OrchestratorCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static Task finished(TaskStatus status) {
        Task task = TaskStateMachine.start(
                Task.pending("E-1", "blog_post", Map.of("topic", "tides"), 2, List.of(), T0), T0);
        Map<String, PhaseResult> results = new LinkedHashMap<>();
        results.put("draft", PhaseResult.succeeded("draft", "# Tides", 0.82, 2, 1500, "ollama"));
        if (status == TaskStatus.FAILED) {
            TaskError error = TaskError.of(ErrorKind.CHAIN_EXHAUSTED, "All providers failed").forPhase("publish", 2);
            results.put("publish", PhaseResult.failed("publish", error, 2, 400));
            return TaskStateMachine.fail(task.withProgress("publish", results, 1),
                    TaskError.of(ErrorKind.REQUIRED_PHASE_FAILED, "Required phase 'publish' failed"), T0.plusSeconds(5));
        }
        return TaskStateMachine.complete(task.withProgress("draft", results, 1),
                Map.of("final_output", "# Tides\n\nBody."), T0.plusSeconds(5));
    }

    @Nested
    @DisplayName("Help output")
    class Help {

        @Test
        @DisplayName("--help lists every subcommand")
        void listsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("phases", "validate", "run", "providers", "health", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("--version shows the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Glad Orchestrator 0.1.0"));
        }

        @Test
        @DisplayName("unknown subcommand exits non-zero")
        void unknownSubcommand() {
            assertNotEquals(0, execute("launch").exitCode());
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("passes topic, keywords and extra input, then prints the final output")
        @SuppressWarnings("unchecked")
        void completes() throws Exception {
            when(executionService.createExecution(eq("blog_post"), anyMap()))
                    .thenReturn(new ExecutionTicket("E-1", TaskStatus.PENDING));
            when(executionService.awaitTerminal(eq("E-1"), any(Duration.class)))
                    .thenReturn(finished(TaskStatus.COMPLETED));

            CliResult result = execute("run", "blog_post", "--topic", "Tides", "-k", "moon,ocean",
                    "-i", "style=casual", "--wait", "PT1M");

            assertEquals(0, result.exitCode());
            ArgumentCaptor<Map<String, Object>> input = ArgumentCaptor.forClass(Map.class);
            verify(executionService).createExecution(eq("blog_post"), input.capture());
            assertEquals("Tides", input.getValue().get("topic"));
            assertEquals(List.of("moon", "ocean"), input.getValue().get("keywords"));
            assertEquals("casual", input.getValue().get("style"));
            verify(executionService).awaitTerminal("E-1", Duration.ofMinutes(1));
            assertTrue(result.output().contains("draft"));
            assertTrue(result.output().contains("score=0.82"));
            assertTrue(result.output().contains("Body."));
        }

        @Test
        @DisplayName("a failed execution exits 1 with the error kind")
        void fails() throws Exception {
            when(executionService.createExecution(eq("blog_post"), anyMap()))
                    .thenReturn(new ExecutionTicket("E-1", TaskStatus.PENDING));
            when(executionService.awaitTerminal(eq("E-1"), any(Duration.class)))
                    .thenReturn(finished(TaskStatus.FAILED));

            CliResult result = execute("run", "blog_post", "--topic", "Tides");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("RequiredPhaseFailed"));
            assertTrue(result.output().contains("ChainExhausted: All providers failed"));
        }

        @Test
        @DisplayName("an unknown workflow exits 1 without waiting")
        void unknownWorkflow() throws Exception {
            when(executionService.createExecution(eq("nope"), anyMap())).thenThrow(new WorkflowNotFoundException("nope"));

            CliResult result = execute("run", "nope");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Workflow not found: nope"));
            verify(executionService, never()).awaitTerminal(any(), any());
        }

        @Test
        @DisplayName("still running after the wait exits 1")
        void notFinished() throws Exception {
            Task running = TaskStateMachine.start(
                    Task.pending("E-1", "blog_post", Map.of(), 4, List.of(), T0), T0);
            when(executionService.createExecution(eq("blog_post"), anyMap()))
                    .thenReturn(new ExecutionTicket("E-1", TaskStatus.PENDING));
            when(executionService.awaitTerminal(eq("E-1"), any(Duration.class))).thenReturn(running);

            CliResult result = execute("run", "blog_post", "--wait", "PT5S");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Still processing"));
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @TempDir
        Path dir;

        private Path write(String json) throws IOException {
            Path file = dir.resolve("workflow.json");
            Files.writeString(file, json);
            return file;
        }

        @Test
        @DisplayName("valid definition exits 0 and registers with --register")
        void validAndRegistered() throws IOException {
            Path file = write("""
                    {"name":"Quick post","description":"d","phases":[{"name":"draft","agent":"content"}]}
                    """);
            when(executionService.validateWorkflowDefinition(any(WorkflowDefinition.class)))
                    .thenReturn(ValidationReport.of(List.of(), List.of()));
            when(executionService.registerWorkflow(any(WorkflowDefinition.class)))
                    .thenAnswer(inv -> ((WorkflowDefinition) inv.getArgument(0)).withId("wf-9"));

            CliResult result = execute("validate", file.toString(), "--register");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("'Quick post' is valid with 1 phase(s)"));
            assertTrue(result.output().contains("Registered as wf-9"));
        }

        @Test
        @DisplayName("invalid definition exits 1 and prints each error")
        void invalid() throws IOException {
            Path file = write("{\"name\":\"\",\"phases\":[]}");
            when(executionService.validateWorkflowDefinition(any(WorkflowDefinition.class)))
                    .thenReturn(ValidationReport.of(
                            List.of("Workflow name cannot be empty", "Workflow must have at least one phase"),
                            List.of()));

            CliResult result = execute("validate", file.toString(), "--register");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Workflow must have at least one phase"));
            assertTrue(result.output().contains("2 errors"));
            verify(executionService, never()).registerWorkflow(any());
        }

        @Test
        @DisplayName("unreadable file exits 2")
        void unreadable() {
            CliResult result = execute("validate", dir.resolve("missing.json").toString());

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Cannot read"));
        }
    }

    @Test
    @DisplayName("phases prints the catalog")
    void phases() {
        when(executionService.listAvailablePhases()).thenReturn(List.of(
                new AvailablePhase("research", "Gather facts", "research", "research", 300, 3, List.of("research"))));

        CliResult result = execute("phases");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("research"));
        assertTrue(result.output().contains("300s"));
    }

    @Test
    @DisplayName("providers --probe shows liveness and reason")
    void providers() {
        when(modelRouter.describeProviders(true)).thenReturn(List.of(
                new ProviderOverview("ollama", "llama3.1:8b", "http://localhost:11434", true,
                        Set.of(Capability.CONTENT, Capability.QA), 0.0, 2.0, null, false, T0,
                        "connection refused", 0, 2, 0.25, 0)));

        CliResult result = execute("providers", "--probe");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("[content,qa]"));
        assertTrue(result.output().contains("connection refused"));
    }

    @Test
    @DisplayName("health prints each component and the overall verdict")
    void health() {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("providers", HealthStatus.Status.DEGRADED, "1/2 providers live", Map.of("gemini", "DOWN")),
                new HealthStatus("taskStore", HealthStatus.Status.UP, "Task store available", Map.of("type", "in-memory"))));

        CliResult result = execute("health");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("providers: 1/2 providers live"));
        assertTrue(result.output().contains("gemini: DOWN"));
        assertTrue(result.output().contains("one or more components degraded or down"));
    }
}
