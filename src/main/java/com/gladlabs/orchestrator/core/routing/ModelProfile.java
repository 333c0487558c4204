package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.model.Capability;

import java.util.Set;

/**
 * Static description of a registered provider. Availability is not part of the profile;
 * it is resolved at selection time through {@link ProviderLivenessCache}.
 *
 * @param providerId    unique provider id used in fallback chains
 * @param model         model id served by the provider
 * @param baseUrl       endpoint root
 * @param capabilities  capabilities the provider serves well
 * @param costWeight    relative cost, higher is more expensive (0 for local models)
 * @param latencyWeight relative latency, higher is slower
 * @param isLocal       runs on local hardware
 */
public record ModelProfile(
    String providerId,
    String model,
    String baseUrl,
    Set<Capability> capabilities,
    double costWeight,
    double latencyWeight,
    boolean isLocal
) {

    public ModelProfile {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean supports(Capability capability) {
        return capability != null && capabilities.contains(capability);
    }
}
