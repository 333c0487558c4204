package com.gladlabs.orchestrator.dispatch.cli;

import com.gladlabs.orchestrator.core.engine.ExecutionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: orchestrator phases
 * <p>
 * Lists the phases a workflow definition can use, with their defaults.
 */
@Command(name = "phases", mixinStandardHelpOptions = true, description = "List available phases")
@Component
public class PhasesCommand implements Runnable {

    private final ExecutionService executionService;

    public PhasesCommand(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        System.out.printf("  %-10s %-9s %-13s %8s %7s  %s%n",
                "PHASE", "AGENT", "CATEGORY", "TIMEOUT", "RETRIES", "DESCRIPTION");
        for (var phase : executionService.listAvailablePhases()) {
            System.out.printf("  %-10s %-9s %-13s %7ds %7d  %s%n",
                    phase.name(), phase.defaultAgent(), phase.category(),
                    phase.defaultTimeoutSeconds(), phase.defaultRetries(), phase.description());
        }
    }
}
