package com.gladlabs.orchestrator.core.phases;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowContext;
import com.gladlabs.orchestrator.core.quality.QualityAssessmentParser;
import com.gladlabs.orchestrator.core.routing.GenerationOutput;
import com.gladlabs.orchestrator.core.routing.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prepares distribution metadata (title, slug, meta description, tags) for the final
 * content. Delivery to a CMS is outside this service; the metadata is the phase output.
 */
@Component
public class PublishPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(PublishPhaseHandler.class);

    static final String SYSTEM_PROMPT = """
            You prepare articles for publication. Respond with JSON only:
            {"title": "...", "slug": "...", "meta_description": "<max 160 chars>", "tags": ["..."]}
            """;

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public Capability capability() {
        return Capability.PUBLISH;
    }

    @Override
    public GenerationRequest buildRequest(PhaseConfig phase, WorkflowContext context) {
        String content = PromptSupport.latestContent(context);
        String user = PromptSupport.line("Topic", PromptSupport.topic(context))
                + PromptSupport.line("Keywords", PromptSupport.keywords(context))
                + "\nArticle:\n" + content;
        return new GenerationRequest(context.executionId(), phase.name(), phase.effectiveTaskType(),
                capability(), SYSTEM_PROMPT, user, null);
    }

    @Override
    public Object interpret(PhaseConfig phase, GenerationOutput output) {
        String json = QualityAssessmentParser.extractJson(output.text());
        Map<String, Object> metadata = new LinkedHashMap<>();
        try {
            metadata.putAll(mapper.readValue(json, new TypeReference<Map<String, Object>>() {}));
        } catch (JsonProcessingException e) {
            log.warn("Publish metadata was not JSON, keeping raw text: {}", e.getOriginalMessage());
            metadata.put("summary", output.text().trim());
        }
        return metadata;
    }
}
