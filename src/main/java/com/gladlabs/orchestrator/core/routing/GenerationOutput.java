package com.gladlabs.orchestrator.core.routing;

/**
 * Raw text returned by a provider.
 *
 * @param providerId      provider that produced the text
 * @param model           model id that produced the text
 * @param text            generated content
 * @param latencyMs       wall time of the call
 * @param estimatedTokens output size in tokens (four characters per token)
 */
public record GenerationOutput(
    String providerId,
    String model,
    String text,
    long latencyMs,
    int estimatedTokens
) {

    public static GenerationOutput of(String providerId, String model, String text, long latencyMs) {
        return new GenerationOutput(providerId, model, text, latencyMs, text == null ? 0 : text.length() / 4);
    }
}
