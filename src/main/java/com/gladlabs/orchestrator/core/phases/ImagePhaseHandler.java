package com.gladlabs.orchestrator.core.phases;

import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowContext;
import com.gladlabs.orchestrator.core.routing.GenerationOutput;
import com.gladlabs.orchestrator.core.routing.GenerationRequest;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces a featured-image brief (generation prompt plus alt text) for the draft.
 */
@Component
public class ImagePhaseHandler implements PhaseHandler {

    static final String SYSTEM_PROMPT = """
            You write briefs for featured images. Reply with two lines:
            PROMPT: <a detailed image generation prompt>
            ALT: <short alt text>
            """;

    @Override
    public Capability capability() {
        return Capability.IMAGE;
    }

    @Override
    public GenerationRequest buildRequest(PhaseConfig phase, WorkflowContext context) {
        String content = PromptSupport.latestContent(context);
        String excerpt = content.length() > 1500 ? content.substring(0, 1500) : content;
        String user = PromptSupport.line("Topic", PromptSupport.topic(context))
                + (excerpt.isBlank() ? "" : "\nArticle excerpt:\n" + excerpt + "\n");
        return new GenerationRequest(context.executionId(), phase.name(), phase.effectiveTaskType(),
                capability(), SYSTEM_PROMPT, user, null);
    }

    @Override
    public Object interpret(PhaseConfig phase, GenerationOutput output) {
        String prompt = null;
        String alt = null;
        for (String line : output.text().split("\n")) {
            String trimmed = line.trim();
            if (trimmed.regionMatches(true, 0, "PROMPT:", 0, 7)) {
                prompt = trimmed.substring(7).trim();
            } else if (trimmed.regionMatches(true, 0, "ALT:", 0, 4)) {
                alt = trimmed.substring(4).trim();
            }
        }
        Map<String, Object> brief = new LinkedHashMap<>();
        brief.put("image_prompt", prompt != null ? prompt : output.text().trim());
        brief.put("alt_text", alt != null ? alt : "");
        brief.put("provider_id", output.providerId());
        return brief;
    }
}
