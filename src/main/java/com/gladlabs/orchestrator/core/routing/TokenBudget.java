package com.gladlabs.orchestrator.core.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Output token budget per task type. The task type is matched by keyword, so
 * {@code "blog_draft"} gets the draft budget.
 */
public class TokenBudget {

    static final Map<String, Integer> DEFAULTS;

    static {
        Map<String, Integer> defaults = new LinkedHashMap<>();
        defaults.put("research", 1200);
        defaults.put("draft", 2000);
        defaults.put("refine", 2000);
        defaults.put("assess", 500);
        defaults.put("image", 300);
        defaults.put("publish", 400);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    public static final int FALLBACK = 800;

    private final Map<String, Integer> budgets;

    public TokenBudget(Map<String, Integer> overrides) {
        Map<String, Integer> merged = new LinkedHashMap<>(DEFAULTS);
        if (overrides != null) {
            overrides.forEach((k, v) -> merged.put(k.toLowerCase(Locale.ROOT), v));
        }
        this.budgets = merged;
    }

    public int maxTokensFor(String taskType) {
        if (taskType == null) {
            return budgets.getOrDefault("default", FALLBACK);
        }
        String normalized = taskType.toLowerCase(Locale.ROOT);
        Integer exact = budgets.get(normalized);
        if (exact != null) {
            return exact;
        }
        return budgets.entrySet().stream()
                .filter(e -> normalized.contains(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(budgets.getOrDefault("default", FALLBACK));
    }

    /** Fills in {@code maxTokens} when the caller left it unset. */
    public GenerationRequest apply(GenerationRequest request) {
        if (request.constraints().maxTokens() != null) {
            return request;
        }
        return request.withConstraints(request.constraints().withMaxTokens(maxTokensFor(request.taskType())));
    }
}
