package com.gladlabs.orchestrator.core.phases;

import com.gladlabs.orchestrator.core.model.PhaseResult;
import com.gladlabs.orchestrator.core.model.WorkflowContext;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Small helpers shared by the phase handlers for assembling prompts.
 */
final class PromptSupport {

    private PromptSupport() {}

    static String topic(WorkflowContext context) {
        String topic = context.inputString("topic");
        return topic.isBlank() ? context.inputString("prompt") : topic;
    }

    static String keywords(WorkflowContext context) {
        Object raw = context.initialInput().get("keywords");
        if (raw instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return raw == null ? "" : String.valueOf(raw);
    }

    static String line(String label, String value) {
        return value == null || value.isBlank() ? "" : label + ": " + value + "\n";
    }

    /** Output of the most recent successful research phase, or empty. */
    static String researchNotes(WorkflowContext context) {
        String notes = "";
        for (PhaseResult result : context.phaseResults().values()) {
            if (result.succeeded() && result.output() instanceof ResearchPhaseHandler.ResearchNotes n) {
                notes = n.text();
            }
        }
        return notes;
    }

    static String latestContent(WorkflowContext context) {
        Object latest = context.latestOutput();
        return latest == null ? "" : String.valueOf(latest);
    }
}
