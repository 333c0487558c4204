package com.gladlabs.orchestrator.core.quality;

import com.gladlabs.orchestrator.core.config.OrchestratorProperties;
import com.gladlabs.orchestrator.core.routing.ModelRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the quality scorer from {@code orchestrator.quality.scorer}.
 */
@Configuration
public class QualityConfig {

    private static final Logger log = LoggerFactory.getLogger(QualityConfig.class);

    @Bean
    public QualityAssessmentParser qualityAssessmentParser() {
        return new QualityAssessmentParser();
    }

    @Bean
    public QualityScorer qualityScorer(OrchestratorProperties properties, ModelRouter router,
                                       QualityAssessmentParser parser) {
        String scorer = properties.getQuality().getScorer();
        if ("heuristic".equalsIgnoreCase(scorer)) {
            log.info("Using heuristic content scorer for quality gates");
            return new HeuristicContentScorer();
        }
        log.info("Using model-based quality scorer for quality gates");
        return new ModelQualityScorer(router, parser);
    }
}
