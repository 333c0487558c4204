package com.gladlabs.orchestrator.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: phases, validate, run, providers, health, serve.
 */
@Command(
        name = "orchestrator",
        mixinStandardHelpOptions = true,
        version = "Glad Orchestrator 0.1.0",
        description = "Multi-phase content generation with provider fallback routing",
        subcommands = {
                PhasesCommand.class,
                ValidateCommand.class,
                RunCommand.class,
                ProvidersCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OrchestratorCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
