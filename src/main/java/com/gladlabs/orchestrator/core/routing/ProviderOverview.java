package com.gladlabs.orchestrator.core.routing;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gladlabs.orchestrator.core.model.Capability;

import java.time.Instant;
import java.util.Set;

/**
 * Read-only view of one registered provider for operators: profile, last liveness
 * result and call statistics.
 *
 * @param live      last known liveness, null when the provider was never probed
 * @param checkedAt when liveness was last determined
 * @param reason    why the provider was marked down
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderOverview(
    String id,
    String model,
    String baseUrl,
    boolean local,
    Set<Capability> capabilities,
    double costWeight,
    double latencyWeight,
    String price,
    Boolean live,
    Instant checkedAt,
    String reason,
    long successes,
    long failures,
    double successRate,
    long lastLatencyMs
) {}
