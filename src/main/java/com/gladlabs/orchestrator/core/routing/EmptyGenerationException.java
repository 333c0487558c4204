package com.gladlabs.orchestrator.core.routing;

/**
 * Thrown when a provider returns null or blank content instead of a valid response.
 */
public class EmptyGenerationException extends ProviderFailureException {

    public EmptyGenerationException(String providerId, String message) {
        super(providerId, message);
    }
}
