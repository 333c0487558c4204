package com.gladlabs.orchestrator.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of one running execution.
 * <p>
 * Confined to the worker thread that runs the execution; not thread-safe. Provider-call
 * threads never see it.
 */
public class WorkflowContext {

    public static final String FEEDBACK = "feedback";
    public static final String SUGGESTIONS = "suggestions";

    private final String workflowId;
    private final String executionId;
    private final Map<String, Object> initialInput;
    private final List<String> tags;
    private final Map<String, PhaseResult> phaseResults = new LinkedHashMap<>();
    private final Map<String, Object> variables = new HashMap<>();
    private final Map<String, Integer> attemptCounters = new HashMap<>();
    private final Map<String, Integer> retryCounters = new HashMap<>();
    private int currentPhaseIndex;
    private Object latestOutput;
    private int refineIterations;

    public WorkflowContext(String workflowId, String executionId, Map<String, Object> initialInput, List<String> tags) {
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.initialInput = initialInput == null ? Map.of() : initialInput;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public String workflowId() {
        return workflowId;
    }

    public String executionId() {
        return executionId;
    }

    public Map<String, Object> initialInput() {
        return initialInput;
    }

    public String inputString(String key) {
        Object value = initialInput.get(key);
        return value == null ? "" : String.valueOf(value);
    }

    public List<String> tags() {
        return tags;
    }

    public Map<String, PhaseResult> phaseResults() {
        return Collections.unmodifiableMap(phaseResults);
    }

    /** Records (or replaces, for refine-loop reruns) the result of a phase. */
    public void recordResult(PhaseResult result) {
        phaseResults.put(result.phaseName(), result);
    }

    public Optional<PhaseResult> resultOf(String phaseName) {
        return Optional.ofNullable(phaseResults.get(phaseName));
    }

    public int currentPhaseIndex() {
        return currentPhaseIndex;
    }

    public void setCurrentPhaseIndex(int currentPhaseIndex) {
        this.currentPhaseIndex = currentPhaseIndex;
    }

    /** Content produced by the most recent successful content phase, carried to later phases. */
    public Object latestOutput() {
        return latestOutput;
    }

    public void setLatestOutput(Object latestOutput) {
        this.latestOutput = latestOutput;
    }

    public Map<String, Object> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public Object variable(String key) {
        return variables.get(key);
    }

    public void putVariable(String key, Object value) {
        variables.put(key, value);
    }

    public void removeVariable(String key) {
        variables.remove(key);
    }

    public int refineIterations() {
        return refineIterations;
    }

    public int incrementRefineIterations() {
        return ++refineIterations;
    }

    /**
     * Next attempt number for the phase. Numbers keep increasing when the refine loop
     * reruns a phase so audit rows never collide.
     */
    public int nextAttemptNumber(String phaseName) {
        return attemptCounters.merge(phaseName, 1, Integer::sum);
    }

    /** Counts one retry of the phase, i.e. an attempt after the first of a phase run. */
    public void recordRetry(String phaseName) {
        retryCounters.merge(phaseName, 1, Integer::sum);
    }

    public int retriesOf(String phaseName) {
        return retryCounters.getOrDefault(phaseName, 0);
    }

    /** Retries consumed across all phases so far, including every refine-loop rerun. */
    public int totalRetries() {
        return retryCounters.values().stream().mapToInt(Integer::intValue).sum();
    }
}
