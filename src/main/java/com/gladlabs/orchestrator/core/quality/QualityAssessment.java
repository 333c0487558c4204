package com.gladlabs.orchestrator.core.quality;

import java.io.Serializable;
import java.util.List;

/**
 * Score and critique of one piece of generated content.
 *
 * @param score       normalized quality in [0,1]
 * @param feedback    critique text, injected into the next refine prompt
 * @param suggestions concrete improvement suggestions
 */
public record QualityAssessment(double score, String feedback, List<String> suggestions) implements Serializable {

    public QualityAssessment {
        score = Math.max(0.0, Math.min(1.0, score));
        feedback = feedback == null ? "" : feedback;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public boolean meets(double threshold) {
        return score >= threshold;
    }
}
