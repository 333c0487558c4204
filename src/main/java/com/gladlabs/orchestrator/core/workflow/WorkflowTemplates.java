package com.gladlabs.orchestrator.core.workflow;

import com.gladlabs.orchestrator.core.model.PhaseConfig;
import com.gladlabs.orchestrator.core.model.WorkflowDefinition;

import java.util.List;

/**
 * Built-in workflow templates registered in every definition store.
 */
public final class WorkflowTemplates {

    public static final String BLOG_POST = "blog_post";
    public static final String SOCIAL_POST = "social_post";
    public static final String RESEARCH_BRIEF = "research_brief";

    private WorkflowTemplates() {}

    public static List<WorkflowDefinition> all() {
        return List.of(blogPost(), socialPost(), researchBrief());
    }

    static WorkflowDefinition blogPost() {
        return new WorkflowDefinition(BLOG_POST, "Blog post",
                "Research, draft, self-critique, featured image and publishing metadata",
                List.of(
                        PhaseConfig.of("research", "research"),
                        PhaseConfig.of("draft", "content"),
                        PhaseConfig.of("assess", "qa").withQualityThreshold(0.75),
                        PhaseConfig.of("refine", "content"),
                        PhaseConfig.of("image", "image").withPolicy(true, false),
                        PhaseConfig.of("publish", "publish")),
                null, true, List.of("blog"));
    }

    static WorkflowDefinition socialPost() {
        return new WorkflowDefinition(SOCIAL_POST, "Social post",
                "Short-form post with one critique pass",
                List.of(
                        new PhaseConfig("draft", "content", "Short social media post", 120, 2,
                                false, true, null, null, "social"),
                        PhaseConfig.of("assess", "qa").withQualityThreshold(0.7),
                        PhaseConfig.of("refine", "content")),
                null, true, List.of("social"));
    }

    static WorkflowDefinition researchBrief() {
        return new WorkflowDefinition(RESEARCH_BRIEF, "Research brief",
                "Research notes condensed into a brief",
                List.of(
                        PhaseConfig.of("research", "research"),
                        new PhaseConfig("brief", "content", "Condense research into a brief", 240, 2,
                                false, true, null, null, "research_brief")),
                null, true, List.of("research"));
    }
}
