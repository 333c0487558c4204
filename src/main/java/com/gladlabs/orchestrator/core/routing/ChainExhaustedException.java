package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every provider in the fallback chain was unavailable or failed.
 */
public class ChainExhaustedException extends OrchestrationException {

    /**
     * Why one provider was passed over.
     */
    public record ProviderFailure(String providerId, String reason) {}

    private final List<ProviderFailure> failures;

    public ChainExhaustedException(String taskType, List<ProviderFailure> failures) {
        super("Fallback chain exhausted for task type '" + taskType + "': " + describe(failures));
        this.failures = List.copyOf(failures);
    }

    public List<ProviderFailure> getFailures() {
        return failures;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CHAIN_EXHAUSTED;
    }

    private static String describe(List<ProviderFailure> failures) {
        return failures.stream()
                .map(f -> f.providerId() + " (" + f.reason() + ")")
                .collect(Collectors.joining(", "));
    }
}
