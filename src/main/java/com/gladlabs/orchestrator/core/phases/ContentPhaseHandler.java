package com.gladlabs.orchestrator.core.phases;

import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowContext;
import com.gladlabs.orchestrator.core.routing.GenerationOutput;
import com.gladlabs.orchestrator.core.routing.GenerationRequest;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Writes a draft, or rewrites the current draft when critique feedback is present in the
 * context variables.
 */
@Component
public class ContentPhaseHandler implements PhaseHandler {

    static final String DRAFT_SYSTEM_PROMPT = """
            You are a professional writer. Write a complete, well-structured markdown article
            with a title, section headings and a conclusion. Use the research notes when given.
            """;

    static final String REFINE_SYSTEM_PROMPT = """
            You are a professional editor. Rewrite the draft so it addresses every point of the
            critique. Keep what already works. Return only the revised markdown article.
            """;

    @Override
    public Capability capability() {
        return Capability.CONTENT;
    }

    @Override
    public GenerationRequest buildRequest(PhaseConfig phase, WorkflowContext context) {
        Object feedback = context.variable(WorkflowContext.FEEDBACK);
        String draft = PromptSupport.latestContent(context);
        if (feedback != null && !draft.isBlank()) {
            String user = PromptSupport.line("Topic", PromptSupport.topic(context))
                    + "\nCritique:\n" + feedback + "\n"
                    + suggestions(context.variable(WorkflowContext.SUGGESTIONS))
                    + "\nDraft:\n" + draft;
            return new GenerationRequest(context.executionId(), phase.name(), phase.effectiveTaskType(),
                    capability(), REFINE_SYSTEM_PROMPT, user, null);
        }
        String notes = PromptSupport.researchNotes(context);
        String user = PromptSupport.line("Topic", PromptSupport.topic(context))
                + PromptSupport.line("Keywords", PromptSupport.keywords(context))
                + PromptSupport.line("Style", context.inputString("style"))
                + PromptSupport.line("Target length", context.inputString("target_length"))
                + (notes.isBlank() ? "" : "\nResearch notes:\n" + notes + "\n")
                + "\nWrite the article.";
        return new GenerationRequest(context.executionId(), phase.name(), phase.effectiveTaskType(),
                capability(), DRAFT_SYSTEM_PROMPT, user, null);
    }

    @Override
    public Object interpret(PhaseConfig phase, GenerationOutput output) {
        return output.text().trim();
    }

    @Override
    public boolean producesContent() {
        return true;
    }

    private static String suggestions(Object raw) {
        if (raw instanceof Collection<?> c && !c.isEmpty()) {
            return "Suggestions:\n" + c.stream().map(s -> "- " + s).collect(Collectors.joining("\n")) + "\n";
        }
        return "";
    }
}
