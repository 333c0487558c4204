package com.gladlabs.orchestrator.core.phases;

import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowContext;
import com.gladlabs.orchestrator.core.quality.QualityAssessmentParser;
import com.gladlabs.orchestrator.core.routing.GenerationConstraints;
import com.gladlabs.orchestrator.core.routing.GenerationOutput;
import com.gladlabs.orchestrator.core.routing.GenerationRequest;
import org.springframework.stereotype.Component;

/**
 * Critiques the current draft. The output is a
 * {@link com.gladlabs.orchestrator.core.quality.QualityAssessment}, which doubles as the
 * phase's quality score.
 */
@Component
public class QaPhaseHandler implements PhaseHandler {

    static final String SYSTEM_PROMPT = """
            You are a strict content editor reviewing a draft before publication.
            Judge accuracy, structure, clarity and keyword coverage.
            Respond with JSON only:
            {"score": <0 to 1>, "feedback": "<critique>", "suggestions": ["<fix>", ...]}
            """;

    private final QualityAssessmentParser parser;

    public QaPhaseHandler(QualityAssessmentParser parser) {
        this.parser = parser;
    }

    @Override
    public Capability capability() {
        return Capability.QA;
    }

    @Override
    public GenerationRequest buildRequest(PhaseConfig phase, WorkflowContext context) {
        String user = PromptSupport.line("Topic", PromptSupport.topic(context))
                + PromptSupport.line("Keywords", PromptSupport.keywords(context))
                + "\nDraft:\n" + PromptSupport.latestContent(context);
        return new GenerationRequest(context.executionId(), phase.name(), phase.effectiveTaskType(),
                capability(), SYSTEM_PROMPT, user, new GenerationConstraints(null, 0.0));
    }

    @Override
    public Object interpret(PhaseConfig phase, GenerationOutput output) {
        return parser.parse(output.text());
    }
}
