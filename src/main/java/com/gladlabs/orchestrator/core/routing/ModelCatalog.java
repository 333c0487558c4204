package com.gladlabs.orchestrator.core.routing;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known models with list prices, used to default a provider's cost weight and to
 * estimate per-call cost.
 */
public final class ModelCatalog {

    private ModelCatalog() {}

    public record ModelInfo(
            String id,
            String provider,
            String tier,
            double inputPricePer1M,
            double outputPricePer1M,
            int contextWindow
    ) {
        public double blendedPricePer1M() {
            return (inputPricePer1M + outputPricePer1M) / 2.0;
        }

        public String priceDisplay() {
            return String.format("$%.2f / $%.2f per 1M tokens", inputPricePer1M, outputPricePer1M);
        }
    }

    public static final List<ModelInfo> OLLAMA_MODELS = List.of(
            new ModelInfo("llama3.1:8b", "ollama", "local", 0, 0, 128000),
            new ModelInfo("mistral:7b", "ollama", "local", 0, 0, 32000),
            new ModelInfo("qwen2.5:14b", "ollama", "local", 0, 0, 128000)
    );

    public static final List<ModelInfo> ANTHROPIC_MODELS = List.of(
            new ModelInfo("claude-sonnet-4-20250514", "anthropic", "flagship", 3.00, 15.00, 200000),
            new ModelInfo("claude-haiku-3-5-20241022", "anthropic", "fast", 0.80, 4.00, 200000)
    );

    public static final List<ModelInfo> OPENAI_MODELS = List.of(
            new ModelInfo("gpt-4o", "openai", "flagship", 2.50, 10.00, 128000),
            new ModelInfo("gpt-4o-mini", "openai", "fast", 0.15, 0.60, 128000)
    );

    public static final List<ModelInfo> GOOGLE_MODELS = List.of(
            new ModelInfo("gemini-2.5-pro", "google", "flagship", 1.25, 10.00, 1000000),
            new ModelInfo("gemini-2.5-flash", "google", "fast", 0.15, 0.60, 1000000)
    );

    public static final Map<String, List<ModelInfo>> ALL_MODELS = Map.of(
            "ollama", OLLAMA_MODELS,
            "anthropic", ANTHROPIC_MODELS,
            "openai", OPENAI_MODELS,
            "google", GOOGLE_MODELS
    );

    public static Optional<ModelInfo> findModel(String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        return ALL_MODELS.values().stream()
                .flatMap(List::stream)
                .filter(m -> m.id().equals(modelId))
                .findFirst();
    }

    /**
     * Cost weight for a model: blended price per 1M tokens divided by ten, so flagship
     * models land around 1.0 and local models at 0. Unknown models get 1.0.
     */
    public static double defaultCostWeight(String modelId) {
        return findModel(modelId).map(m -> m.blendedPricePer1M() / 10.0).orElse(1.0);
    }

    public static double estimateCostUsd(String modelId, int inputTokens, int outputTokens) {
        return findModel(modelId)
                .map(m -> (inputTokens * m.inputPricePer1M() + outputTokens * m.outputPricePer1M()) / 1_000_000.0)
                .orElse(0.0);
    }
}
