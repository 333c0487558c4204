package com.gladlabs.orchestrator.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during workflow execution, used for SSE streaming and logging.
 *
 * @param eventType   event type (e.g. "execution.started", "phase.completed", "provider.failed")
 * @param executionId the execution this event belongs to
 * @param phaseName   the phase this event relates to (nullable for execution-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record OrchestrationEvent(
    String eventType,
    String executionId,
    String phaseName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static OrchestrationEvent of(String eventType, String executionId, String phaseName,
                                        Map<String, Object> payload) {
        return new OrchestrationEvent(eventType, executionId, phaseName,
                payload == null ? Map.of() : payload, Instant.now());
    }
}
