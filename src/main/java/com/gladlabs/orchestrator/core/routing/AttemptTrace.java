package com.gladlabs.orchestrator.core.routing;

/**
 * Shared between the worker waiting on an attempt and the provider-call thread running it.
 * The router records which provider is in flight; the worker flags the attempt abandoned
 * on timeout so the call thread stops walking the chain.
 */
public class AttemptTrace {

    private volatile String currentProvider;
    private volatile boolean abandoned;

    public String currentProvider() {
        return currentProvider;
    }

    void setCurrentProvider(String providerId) {
        this.currentProvider = providerId;
    }

    public boolean isAbandoned() {
        return abandoned;
    }

    public void abandon() {
        this.abandoned = true;
    }
}
