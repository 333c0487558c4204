package com.gladlabs.orchestrator.core.workflow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A phase workflow authors can pick, with the defaults applied when they leave fields empty.
 */
public record AvailablePhase(
    String name,
    String description,
    String category,
    @JsonProperty("default_agent") String defaultAgent,
    @JsonProperty("default_timeout_seconds") int defaultTimeoutSeconds,
    @JsonProperty("default_retries") int defaultRetries,
    List<String> capabilities
) {}
