package com.gladlabs.orchestrator.core.routing;

/**
 * A provider the router confirmed live, paired with its profile.
 */
public record ProviderHandle(ModelProfile profile, GenerationProvider provider) {

    public String providerId() {
        return profile.providerId();
    }
}
