package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.model.ErrorKind;
import com.gladlabs.orchestrator.core.model.OrchestrationException;

/**
 * No provider in the resolved chain is currently live.
 */
public class NoProviderAvailableException extends OrchestrationException {

    public NoProviderAvailableException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NO_PROVIDER_AVAILABLE;
    }
}
