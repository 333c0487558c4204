package com.gladlabs.orchestrator.core.routing;

import com.gladlabs.orchestrator.core.config.OrchestratorProperties;
import com.gladlabs.orchestrator.core.model.Capability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the immutable provider registry and the routing collaborators from
 * {@code orchestrator.providers} and {@code orchestrator.routing}.
 */
@Configuration
public class RoutingConfig {

    private static final Logger log = LoggerFactory.getLogger(RoutingConfig.class);

    @Bean
    public ProviderRegistry providerRegistry(OrchestratorProperties properties) {
        Duration probeTimeout = properties.getRouting().getProbeTimeout();
        List<ProviderHandle> handles = new ArrayList<>();
        for (OrchestratorProperties.Provider p : properties.getProviders()) {
            ModelProfile profile = toProfile(p);
            GenerationProvider provider = new OpenAiCompatibleProvider(p.getId(), p.getModel(), p.getBaseUrl(),
                    p.getApiKey(), p.getCompletionsPath(), p.getTemperature(), probeTimeout);
            handles.add(new ProviderHandle(profile, provider));
            log.info("Registered provider {} → {} at {} (capabilities {}, local={})",
                    p.getId(), p.getModel(), p.getBaseUrl(), profile.capabilities(), p.isLocal());
        }
        if (handles.isEmpty()) {
            log.warn("No providers configured under orchestrator.providers; every execution will fail routing");
        }
        return new ProviderRegistry(handles);
    }

    static ModelProfile toProfile(OrchestratorProperties.Provider p) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (String id : p.getCapabilities()) {
            capabilities.add(Capability.require(id));
        }
        double costWeight = p.getCostWeight() != null
                ? p.getCostWeight()
                : (p.isLocal() ? 0.0 : ModelCatalog.defaultCostWeight(p.getModel()));
        return new ModelProfile(p.getId(), p.getModel(), p.getBaseUrl(), capabilities,
                costWeight, p.getLatencyWeight(), p.isLocal());
    }

    @Bean
    public FallbackChains fallbackChains(OrchestratorProperties properties) {
        return new FallbackChains(properties.getRouting().getChains());
    }

    @Bean
    public ProviderSelector providerSelector(OrchestratorProperties properties) {
        OrchestratorProperties.Weights w = properties.getRouting().getWeights();
        return new ProviderSelector(new RoutingWeights(w.getSuccessRate(), w.getCapabilityMatch(),
                w.getLatency(), w.getCost()));
    }

    @Bean
    public ProviderLivenessCache providerLivenessCache(OrchestratorProperties properties, Clock clock) {
        return new ProviderLivenessCache(properties.getRouting().getLivenessTtl(), clock);
    }

    @Bean
    public ProviderStatistics providerStatistics() {
        return new ProviderStatistics();
    }

    @Bean
    public TokenBudget tokenBudget(OrchestratorProperties properties) {
        return new TokenBudget(properties.getRouting().getMaxTokens());
    }
}
