package com.gladlabs.orchestrator.core.quality;

/**
 * Scores phase output for the quality gate.
 */
public interface QualityScorer {

    QualityAssessment assess(QualityRequest request);
}
