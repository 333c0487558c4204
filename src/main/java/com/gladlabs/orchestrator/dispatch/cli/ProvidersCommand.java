package com.gladlabs.orchestrator.dispatch.cli;

import com.gladlabs.orchestrator.core.routing.ModelRouter;
import com.gladlabs.orchestrator.core.routing.ProviderOverview;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.stream.Collectors;

/**
 * CLI command: orchestrator providers
 * <p>
 * Lists configured providers and, with {@code --probe}, checks which are reachable.
 */
@Command(name = "providers", mixinStandardHelpOptions = true, description = "List configured providers")
@Component
public class ProvidersCommand implements Runnable {

    @Option(names = {"--probe", "-p"}, description = "Probe each provider for liveness")
    private boolean probe;

    private final ModelRouter modelRouter;

    public ProvidersCommand(ModelRouter modelRouter) {
        this.modelRouter = modelRouter;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var providers = modelRouter.describeProviders(probe);
        if (providers.isEmpty()) {
            ConsoleOutput.error("No providers configured (orchestrator.providers)");
            return;
        }
        for (ProviderOverview p : providers) {
            String capabilities = p.capabilities().stream().map(c -> c.id()).sorted().collect(Collectors.joining(","));
            String line = String.format("%-12s %-28s [%s]%s%s", p.id(), p.model(), capabilities,
                    p.local() ? " local" : "", p.price() == null ? "" : " " + p.price());
            if (p.live() == null) {
                ConsoleOutput.info(line + " (not probed)");
            } else if (p.live()) {
                ConsoleOutput.success(line);
            } else {
                ConsoleOutput.error(line + (p.reason() == null ? "" : " (" + p.reason() + ")"));
            }
        }
    }
}
