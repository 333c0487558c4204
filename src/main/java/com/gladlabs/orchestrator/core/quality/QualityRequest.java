package com.gladlabs.orchestrator.core.quality;

import java.util.Map;

/**
 * Content to be scored plus the execution input it was generated for (topic, keywords).
 */
public record QualityRequest(String executionId, String phaseName, String content, Map<String, Object> input) {

    public QualityRequest {
        input = input == null ? Map.of() : input;
    }
}
