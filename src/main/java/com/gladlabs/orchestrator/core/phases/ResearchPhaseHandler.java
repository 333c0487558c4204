package com.gladlabs.orchestrator.core.phases;

import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowContext;
import com.gladlabs.orchestrator.core.routing.GenerationOutput;
import com.gladlabs.orchestrator.core.routing.GenerationRequest;
import org.springframework.stereotype.Component;

/**
 * Gathers background facts and angles for the topic.
 */
@Component
public class ResearchPhaseHandler implements PhaseHandler {

    /** Research output, kept distinct from draft text so later phases can find it. */
    public record ResearchNotes(String text) {
        @Override
        public String toString() {
            return text;
        }
    }

    static final String SYSTEM_PROMPT = """
            You are a research assistant preparing notes for a writer.
            Produce concise bullet points: key facts, current trends, common questions and credible angles.
            Do not write the article itself.
            """;

    @Override
    public Capability capability() {
        return Capability.RESEARCH;
    }

    @Override
    public GenerationRequest buildRequest(PhaseConfig phase, WorkflowContext context) {
        String user = PromptSupport.line("Topic", PromptSupport.topic(context))
                + PromptSupport.line("Keywords", PromptSupport.keywords(context))
                + PromptSupport.line("Audience", context.inputString("audience"))
                + "\nResearch this topic.";
        return new GenerationRequest(context.executionId(), phase.name(), phase.effectiveTaskType(),
                capability(), SYSTEM_PROMPT, user, null);
    }

    @Override
    public Object interpret(PhaseConfig phase, GenerationOutput output) {
        return new ResearchNotes(output.text().trim());
    }
}
