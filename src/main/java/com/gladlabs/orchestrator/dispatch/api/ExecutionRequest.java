package com.gladlabs.orchestrator.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request body for starting an execution.
 */
public record ExecutionRequest(
    @JsonProperty("workflow_id") String workflowId,
    Map<String, Object> input
) {}
