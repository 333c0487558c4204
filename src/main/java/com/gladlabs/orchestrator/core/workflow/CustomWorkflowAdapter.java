package com.gladlabs.orchestrator.core.workflow;

import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowDefinition;
import com.gladlabs.orchestrator.core.routing.FallbackChains;
import com.gladlabs.orchestrator.core.routing.ProviderRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates user-authored workflow definitions and converts them into executable plans.
 * Everything here is pure over the definition and the provider registry.
 */
@Component
public class CustomWorkflowAdapter {

    public static final int MIN_TIMEOUT_SECONDS = 1;
    public static final int MAX_TIMEOUT_SECONDS = 3600;
    public static final int SHORT_TIMEOUT_SECONDS = 10;
    public static final int MAX_RETRIES = 10;

    static final String REFINE_PHASE = "refine";

    private final ProviderRegistry providers;

    public CustomWorkflowAdapter(ProviderRegistry providers) {
        this.providers = providers;
    }

    public ValidationReport validate(WorkflowDefinition definition) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (definition == null) {
            errors.add("Workflow definition is required");
            return ValidationReport.of(errors, warnings);
        }
        if (definition.name() == null || definition.name().isBlank()) {
            errors.add("Workflow name cannot be empty");
        }
        if (definition.description() == null || definition.description().isBlank()) {
            warnings.add("Workflow has no description");
        }
        if (definition.phases().isEmpty()) {
            errors.add("Workflow must have at least one phase");
            return ValidationReport.of(errors, warnings);
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (PhaseConfig phase : definition.phases()) {
            if (phase.name() != null && !seen.add(phase.name())) {
                duplicates.add(phase.name());
            }
        }
        if (!duplicates.isEmpty()) {
            errors.add("Duplicate phase names in workflow: " + String.join(", ", duplicates));
        }

        for (int i = 0; i < definition.phases().size(); i++) {
            validatePhase(i, definition.phases().get(i), errors, warnings);
        }
        return ValidationReport.of(errors, warnings);
    }

    private void validatePhase(int index, PhaseConfig phase, List<String> errors, List<String> warnings) {
        String label = phase.name() == null || phase.name().isBlank()
                ? "#" + (index + 1)
                : "'" + phase.name() + "'";
        if (phase.name() == null || phase.name().isBlank()) {
            errors.add("Phase " + label + " must have a name");
        }
        if (phase.agent() == null || phase.agent().isBlank()) {
            errors.add("Phase " + label + " must specify an agent");
        } else if (Capability.fromId(phase.agent()).isEmpty()) {
            errors.add("Phase " + label + " has unknown agent '" + phase.agent() + "' (known: "
                    + Arrays.stream(Capability.values()).map(Capability::id).toList() + ")");
        }
        Integer timeout = phase.timeoutSeconds();
        if (timeout != null) {
            if (timeout < MIN_TIMEOUT_SECONDS || timeout > MAX_TIMEOUT_SECONDS) {
                errors.add("Phase " + label + " timeout " + timeout + "s is outside "
                        + MIN_TIMEOUT_SECONDS + "-" + MAX_TIMEOUT_SECONDS + "s");
            } else if (timeout < SHORT_TIMEOUT_SECONDS) {
                warnings.add("Phase " + label + " timeout " + timeout + "s is very short");
            }
        }
        Integer retries = phase.maxRetries();
        if (retries != null && (retries < 0 || retries > MAX_RETRIES)) {
            errors.add("Phase " + label + " max_retries " + retries + " is outside 0-" + MAX_RETRIES);
        }
        Double threshold = phase.qualityThreshold();
        if (threshold != null && (threshold.isNaN() || threshold < 0.0 || threshold > 1.0)) {
            errors.add("Phase " + label + " quality_threshold " + threshold + " is outside [0, 1]");
        }
        for (String providerId : FallbackChains.providerIds(phase.providerChain())) {
            if (!providers.contains(providerId)) {
                errors.add("Phase " + label + " provider_chain references unknown provider '" + providerId + "'");
            }
        }
        if (phase.isSkipOnError() && phase.isRequired()) {
            warnings.add("Phase " + label + " is required, so skip_on_error has no effect");
        }
    }

    /**
     * Phases with catalog defaults applied for missing timeout, retries and description.
     */
    public List<PhaseConfig> buildPhases(WorkflowDefinition definition) {
        List<PhaseConfig> phases = new ArrayList<>(definition.phases().size());
        for (PhaseConfig phase : definition.phases()) {
            var catalog = AvailablePhaseCatalog.find(phase.name());
            PhaseConfig built = phase;
            if (built.timeoutSeconds() == null) {
                built = built.withTimeoutSeconds(catalog.map(AvailablePhase::defaultTimeoutSeconds)
                        .orElse(AvailablePhaseCatalog.DEFAULT_TIMEOUT_SECONDS));
            }
            if (built.maxRetries() == null) {
                built = built.withMaxRetries(catalog.map(AvailablePhase::defaultRetries)
                        .orElse(AvailablePhaseCatalog.DEFAULT_MAX_RETRIES));
            }
            if (built.description() == null && catalog.isPresent()) {
                built = built.withDescription(catalog.get().description());
            }
            phases.add(built);
        }
        return phases;
    }

    /**
     * Groups a QA phase immediately followed by a content phase named {@code refine} into
     * a refine-loop step; every other phase becomes a single step.
     *
     * @throws WorkflowValidationException when the definition is invalid
     */
    public WorkflowPlan buildPlan(WorkflowDefinition definition) {
        ValidationReport report = validate(definition);
        if (!report.valid()) {
            throw new WorkflowValidationException(report);
        }
        List<PhaseConfig> phases = buildPhases(definition);
        List<PlanStep> steps = new ArrayList<>();
        for (int i = 0; i < phases.size(); i++) {
            PhaseConfig phase = phases.get(i);
            PhaseConfig next = i + 1 < phases.size() ? phases.get(i + 1) : null;
            if (next != null && isAssess(phase) && isRefine(next)) {
                steps.add(new PlanStep.RefineLoopStep(phase, next));
                i++;
            } else {
                steps.add(new PlanStep.PhaseStep(phase));
            }
        }
        return new WorkflowPlan(definition.id(), steps, definition.tags());
    }

    public List<AvailablePhase> listAvailablePhases() {
        return AvailablePhaseCatalog.PHASES;
    }

    private static boolean isAssess(PhaseConfig phase) {
        return Capability.fromId(phase.agent()).filter(c -> c == Capability.QA).isPresent();
    }

    private static boolean isRefine(PhaseConfig phase) {
        return REFINE_PHASE.equals(phase.name())
                && Capability.fromId(phase.agent()).filter(c -> c == Capability.CONTENT).isPresent();
    }
}
