package com.gladlabs.orchestrator.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gladlabs.orchestrator.core.engine.ExecutionService;
import com.gladlabs.orchestrator.core.model.WorkflowDefinition;
import com.gladlabs.orchestrator.core.workflow.ValidationReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: orchestrator validate &lt;file&gt;
 * <p>
 * Validates a workflow definition stored as JSON. Exits 1 when it is invalid.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a workflow definition file")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow definition JSON file")
    private Path file;

    @Option(names = {"--register", "-r"}, description = "Store the definition when it is valid")
    private boolean register;

    private final ExecutionService executionService;
    private final ObjectMapper objectMapper;

    public ValidateCommand(ExecutionService executionService, ObjectMapper objectMapper) {
        this.executionService = executionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        WorkflowDefinition definition;
        try {
            definition = objectMapper.readValue(Files.readString(file), WorkflowDefinition.class);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }

        ValidationReport report = executionService.validateWorkflowDefinition(definition);
        report.errors().forEach(ConsoleOutput::error);
        report.warnings().forEach(ConsoleOutput::warn);
        if (!report.valid()) {
            ConsoleOutput.error("Definition is invalid (" + report.errors().size() + " error"
                    + (report.errors().size() != 1 ? "s" : "") + ")");
            return 1;
        }
        ConsoleOutput.success("Definition '" + definition.name() + "' is valid with "
                + definition.phases().size() + " phase(s)");
        if (register) {
            WorkflowDefinition saved = executionService.registerWorkflow(definition);
            ConsoleOutput.success("Registered as " + saved.id());
        }
        return 0;
    }
}
