package com.gladlabs.orchestrator.core.workflow;

import java.util.List;
import java.util.Optional;

/**
 * Built-in phase catalog.
 */
public final class AvailablePhaseCatalog {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_MAX_RETRIES = 2;

    public static final List<AvailablePhase> PHASES = List.of(
            new AvailablePhase("research", "Research phase - gathers information on the topic",
                    "content", "research", 300, 3, List.of("web_search", "data_analysis")),
            new AvailablePhase("draft", "Draft generation - produces the initial content",
                    "content", "content", 300, 2, List.of("content_generation", "style_matching")),
            new AvailablePhase("assess", "Quality assessment - scores the content and writes feedback",
                    "quality", "qa", 240, 1, List.of("quality_scoring", "feedback")),
            new AvailablePhase("refine", "Content refinement - rewrites the draft using assessment feedback",
                    "content", "content", 300, 2, List.of("content_refinement", "iteration")),
            new AvailablePhase("image", "Image brief - featured image prompt and alt text",
                    "media", "image", 600, 2, List.of("image_generation", "image_selection")),
            new AvailablePhase("publish", "Publishing - title, slug and SEO metadata for distribution",
                    "distribution", "publish", 180, 1, List.of("publishing", "seo_optimization"))
    );

    private AvailablePhaseCatalog() {}

    public static Optional<AvailablePhase> find(String name) {
        return PHASES.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
