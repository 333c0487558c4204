package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Configuration of one phase inside a {@link WorkflowDefinition}.
 * <p>
 * {@code timeoutSeconds} and {@code maxRetries} may be left null by the author; the
 * workflow adapter fills them from the available-phase catalog before execution.
 *
 * @param name             phase name, unique within the definition
 * @param agent            capability id that executes the phase (research, content, qa, image, publish)
 * @param description      free text
 * @param timeoutSeconds   per-attempt timeout
 * @param maxRetries       retries after the first attempt
 * @param skipOnError      skip instead of fail when retries run out (only if not required)
 * @param required         a failure of this phase fails the execution
 * @param qualityThreshold minimum accepted quality score in [0,1], or null for no gate
 * @param providerChain    per-phase override of the provider fallback chain
 * @param taskType         routing hint; defaults to the phase name
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhaseConfig(
    String name,
    String agent,
    String description,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds,
    @JsonProperty("max_retries") Integer maxRetries,
    @JsonProperty("skip_on_error") Boolean skipOnError,
    Boolean required,
    @JsonProperty("quality_threshold") Double qualityThreshold,
    @JsonProperty("provider_chain") List<String> providerChain,
    @JsonProperty("task_type") String taskType
) implements Serializable {

    public PhaseConfig {
        skipOnError = skipOnError != null && skipOnError;
        required = required == null || required;
        providerChain = providerChain == null ? List.of() : List.copyOf(providerChain);
    }

    public static PhaseConfig of(String name, String agent) {
        return new PhaseConfig(name, agent, null, null, null, null, null, null, null, null);
    }

    public String effectiveTaskType() {
        return taskType == null || taskType.isBlank() ? name : taskType;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isSkipOnError() {
        return skipOnError;
    }

    public PhaseConfig withTimeoutSeconds(Integer value) {
        return new PhaseConfig(name, agent, description, value, maxRetries, skipOnError, required,
                qualityThreshold, providerChain, taskType);
    }

    public PhaseConfig withMaxRetries(Integer value) {
        return new PhaseConfig(name, agent, description, timeoutSeconds, value, skipOnError, required,
                qualityThreshold, providerChain, taskType);
    }

    public PhaseConfig withQualityThreshold(Double value) {
        return new PhaseConfig(name, agent, description, timeoutSeconds, maxRetries, skipOnError, required,
                value, providerChain, taskType);
    }

    public PhaseConfig withPolicy(boolean skip, boolean isRequired) {
        return new PhaseConfig(name, agent, description, timeoutSeconds, maxRetries, skip, isRequired,
                qualityThreshold, providerChain, taskType);
    }

    public PhaseConfig withProviderChain(List<String> chain) {
        return new PhaseConfig(name, agent, description, timeoutSeconds, maxRetries, skipOnError, required,
                qualityThreshold, chain, taskType);
    }

    public PhaseConfig withDescription(String value) {
        return new PhaseConfig(name, agent, value, timeoutSeconds, maxRetries, skipOnError, required,
                qualityThreshold, providerChain, taskType);
    }

    /** Same phase without a quality gate; used when the phase itself produces the score. */
    public PhaseConfig withoutQualityGate() {
        return withQualityThreshold(null);
    }
}
