package com.gladlabs.orchestrator.core.quality;

import com.gladlabs.orchestrator.core.model.Capability;
import com.gladlabs.orchestrator.core.routing.GenerationConstraints;
import com.gladlabs.orchestrator.core.routing.GenerationOutput;
import com.gladlabs.orchestrator.core.routing.GenerationRequest;
import com.gladlabs.orchestrator.core.routing.ModelRouter;

import java.util.List;

/**
 * Scores content by routing a critique prompt to a QA-capable provider.
 */
public class ModelQualityScorer implements QualityScorer {

    static final String TASK_TYPE = "assess";

    static final String SYSTEM_PROMPT = """
            You are a strict content editor. Rate the content you are given.
            Respond with JSON only, in this shape:
            {"score": <number between 0 and 1>, "feedback": "<one paragraph critique>", "suggestions": ["<short fix>", ...]}
            """;

    private final ModelRouter router;
    private final QualityAssessmentParser parser;

    public ModelQualityScorer(ModelRouter router, QualityAssessmentParser parser) {
        this.router = router;
        this.parser = parser;
    }

    @Override
    public QualityAssessment assess(QualityRequest request) {
        String topic = String.valueOf(request.input().getOrDefault("topic", ""));
        String user = (topic.isBlank() ? "" : "Topic: " + topic + "\n\n")
                + "Content to rate:\n\n" + request.content();
        GenerationRequest generation = new GenerationRequest(request.executionId(), request.phaseName(),
                TASK_TYPE, Capability.QA, SYSTEM_PROMPT, user, new GenerationConstraints(null, 0.0));
        GenerationOutput output = router.route(generation, List.of());
        return parser.parse(output.text());
    }
}
