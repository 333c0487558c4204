package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;

/**
 * A single provider call failed (transport error, API error, empty output).
 */
public class ProviderFailureException extends OrchestrationException {

    private final String providerId;

    public ProviderFailureException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public ProviderFailureException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER_FAILURE;
    }
}
