package com.gladlabs.orchestrator.dispatch.cli;

import com.gladlabs.orchestrator.core.engine.ExecutionService;
import com.gladlabs.orchestrator.core.engine.ExecutionTicket;
import com.gladlabs.orchestrator.core.model.OrchestrationException;
import com.gladlabs.orchestrator.core.model.Task;
import com.gladlabs.orchestrator.core.model.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: orchestrator run &lt;workflowId&gt; --topic "..."
 * <p>
 * Starts an execution and waits for it to finish, printing each phase result.
 * Exits 0 when the execution completed, 1 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a workflow and wait for the result")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow id (e.g. blog_post)")
    private String workflowId;

    @Option(names = {"--topic", "-t"}, description = "Topic to write about")
    private String topic;

    @Option(names = {"--keywords", "-k"}, split = ",", description = "Comma-separated keywords")
    private String[] keywords;

    @Option(names = {"--input", "-i"}, description = "Extra input as key=value")
    private Map<String, String> extraInput = new LinkedHashMap<>();

    @Option(names = "--wait", defaultValue = "PT30M", description = "Maximum time to wait (ISO-8601 duration)")
    private Duration wait;

    private final ExecutionService executionService;

    public RunCommand(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Map<String, Object> input = new LinkedHashMap<>(extraInput);
        if (topic != null) {
            input.put("topic", topic);
        }
        if (keywords != null) {
            input.put("keywords", Arrays.asList(keywords));
        }

        ExecutionTicket ticket;
        try {
            ticket = executionService.createExecution(workflowId, input);
        } catch (OrchestrationException e) {
            ConsoleOutput.error(e.kind().label() + ": " + e.getMessage());
            return 1;
        }
        ConsoleOutput.info("Execution " + ticket.executionId() + " accepted; running " + workflowId + "...");

        Task task;
        try {
            task = executionService.awaitTerminal(ticket.executionId(), wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executionService.cancelExecution(ticket.executionId());
            ConsoleOutput.error("Interrupted; cancellation requested");
            return 130;
        }

        System.out.println();
        task.phaseResults().values().forEach(ConsoleOutput::phaseResult);
        System.out.println(ConsoleOutput.RULE);

        if (!task.isTerminal()) {
            ConsoleOutput.error("Still " + task.status().value() + " after " + wait.toSeconds() + "s ("
                    + task.progressPercent() + "% done)");
            return 1;
        }
        if (task.status() != TaskStatus.COMPLETED) {
            ConsoleOutput.error("Execution " + task.status().value()
                    + (task.error() == null ? "" : ": " + ConsoleOutput.describe(task.error())));
            return 1;
        }
        ConsoleOutput.success("Execution completed");
        Object output = task.result() == null ? null : task.result().get("final_output");
        if (output != null) {
            System.out.println();
            System.out.println(output);
        }
        return 0;
    }
}
