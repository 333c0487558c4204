package com.gladlabs.orchestrator.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration bound from {@code orchestrator.*}.
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private final Engine engine = new Engine();
    private final Retry retry = new Retry();
    private final Routing routing = new Routing();
    private final Quality quality = new Quality();
    private List<Provider> providers = new ArrayList<>();

    public Engine getEngine() {
        return engine;
    }

    public Retry getRetry() {
        return retry;
    }

    public Routing getRouting() {
        return routing;
    }

    public Quality getQuality() {
        return quality;
    }

    public List<Provider> getProviders() {
        return providers;
    }

    public void setProviders(List<Provider> providers) {
        this.providers = providers;
    }

    public static class Engine {

        private int maxConcurrentExecutions = 4;
        private Duration workflowTimeout = Duration.ofMinutes(30);
        private int maxRefineIterations = 3;
        private double defaultQualityThreshold = 0.7;
        /** Mark executions left in processing by a previous run as failed on startup. */
        private boolean recoverOrphans = true;

        public int getMaxConcurrentExecutions() {
            return maxConcurrentExecutions;
        }

        public void setMaxConcurrentExecutions(int maxConcurrentExecutions) {
            this.maxConcurrentExecutions = maxConcurrentExecutions;
        }

        public Duration getWorkflowTimeout() {
            return workflowTimeout;
        }

        public void setWorkflowTimeout(Duration workflowTimeout) {
            this.workflowTimeout = workflowTimeout;
        }

        public int getMaxRefineIterations() {
            return maxRefineIterations;
        }

        public void setMaxRefineIterations(int maxRefineIterations) {
            this.maxRefineIterations = maxRefineIterations;
        }

        public double getDefaultQualityThreshold() {
            return defaultQualityThreshold;
        }

        public void setDefaultQualityThreshold(double defaultQualityThreshold) {
            this.defaultQualityThreshold = defaultQualityThreshold;
        }

        public boolean isRecoverOrphans() {
            return recoverOrphans;
        }

        public void setRecoverOrphans(boolean recoverOrphans) {
            this.recoverOrphans = recoverOrphans;
        }
    }

    public static class Retry {

        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double jitter = 0.2;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class Routing {

        private Duration livenessTtl = Duration.ofSeconds(30);
        private Duration probeTimeout = Duration.ofSeconds(5);
        /**
         * Fallback chains keyed by task type, capability id or "default". Each entry is one
         * priority tier; providers sharing a tier are written as {@code "a|b"}.
         */
        private Map<String, List<String>> chains = new LinkedHashMap<>();
        private Map<String, Integer> maxTokens = new LinkedHashMap<>();
        private final Weights weights = new Weights();

        public Duration getLivenessTtl() {
            return livenessTtl;
        }

        public void setLivenessTtl(Duration livenessTtl) {
            this.livenessTtl = livenessTtl;
        }

        public Duration getProbeTimeout() {
            return probeTimeout;
        }

        public void setProbeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
        }

        public Map<String, List<String>> getChains() {
            return chains;
        }

        public void setChains(Map<String, List<String>> chains) {
            this.chains = chains;
        }

        public Map<String, Integer> getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Map<String, Integer> maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Weights getWeights() {
            return weights;
        }
    }

    public static class Weights {

        private double successRate = 0.4;
        private double capabilityMatch = 0.3;
        private double latency = 0.15;
        private double cost = 0.15;

        public double getSuccessRate() {
            return successRate;
        }

        public void setSuccessRate(double successRate) {
            this.successRate = successRate;
        }

        public double getCapabilityMatch() {
            return capabilityMatch;
        }

        public void setCapabilityMatch(double capabilityMatch) {
            this.capabilityMatch = capabilityMatch;
        }

        public double getLatency() {
            return latency;
        }

        public void setLatency(double latency) {
            this.latency = latency;
        }

        public double getCost() {
            return cost;
        }

        public void setCost(double cost) {
            this.cost = cost;
        }
    }

    public static class Quality {

        /** "model" routes scoring to a QA-capable provider, "heuristic" scores locally. */
        private String scorer = "model";

        public String getScorer() {
            return scorer;
        }

        public void setScorer(String scorer) {
            this.scorer = scorer;
        }
    }

    public static class Provider {

        private String id;
        private String baseUrl;
        private String apiKey = "";
        private String model;
        private String completionsPath = "/v1/chat/completions";
        private List<String> capabilities = new ArrayList<>();
        private Double costWeight;
        private double latencyWeight = 1.0;
        private boolean local;
        private double temperature = 0.7;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getCompletionsPath() {
            return completionsPath;
        }

        public void setCompletionsPath(String completionsPath) {
            this.completionsPath = completionsPath;
        }

        public List<String> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(List<String> capabilities) {
            this.capabilities = capabilities;
        }

        public Double getCostWeight() {
            return costWeight;
        }

        public void setCostWeight(Double costWeight) {
            this.costWeight = costWeight;
        }

        public double getLatencyWeight() {
            return latencyWeight;
        }

        public void setLatencyWeight(double latencyWeight) {
            this.latencyWeight = latencyWeight;
        }

        public boolean isLocal() {
            return local;
        }

        public void setLocal(boolean local) {
            this.local = local;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
