package com.gladlabs.orchestrator.core.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Provider backed by any OpenAI-compatible chat completions endpoint (OpenAI, Ollama's
 * {@code /v1} API, the Anthropic and Gemini compatibility endpoints).
 * <p>
 * Calls go through Spring AI's {@link ChatClient}; liveness is a {@code GET} on the
 * endpoint's models listing.
 */
public class OpenAiCompatibleProvider implements GenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);

    private final String id;
    private final String model;
    private final String baseUrl;
    private final String apiKey;
    private final String modelsPath;
    private final double temperature;
    private final ChatClient chatClient;
    private final HttpClient httpClient;
    private final Duration probeTimeout;

    public OpenAiCompatibleProvider(String id, String model, String baseUrl, String apiKey, String completionsPath,
                                    double temperature, Duration probeTimeout) {
        this(id, model, baseUrl, apiKey, completionsPath, temperature,
                buildChatClient(model, baseUrl, apiKey, completionsPath),
                HttpClient.newBuilder().connectTimeout(probeTimeout).build(), probeTimeout);
    }

    OpenAiCompatibleProvider(String id, String model, String baseUrl, String apiKey, String completionsPath,
                             double temperature, ChatClient chatClient, HttpClient httpClient,
                             Duration probeTimeout) {
        this.id = id;
        this.model = model;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey;
        this.modelsPath = completionsPath.replace("chat/completions", "models");
        this.temperature = temperature;
        this.chatClient = chatClient;
        this.httpClient = httpClient;
        this.probeTimeout = probeTimeout;
    }

    private static ChatClient buildChatClient(String model, String baseUrl, String apiKey, String completionsPath) {
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(stripTrailingSlash(baseUrl))
                .apiKey(apiKey == null || apiKey.isBlank() ? "none" : apiKey)
                .completionsPath(completionsPath)
                .build();
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(model).build())
                .build();
        return ChatClient.builder(chatModel).build();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean probe() {
        var builder = HttpRequest.newBuilder(URI.create(baseUrl + modelsPath))
                .timeout(probeTimeout)
                .GET();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        try {
            HttpResponse<Void> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.discarding());
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFailureException(id, "Probe interrupted", e);
        } catch (IOException e) {
            log.debug("Probe of {} at {} failed: {}", id, baseUrl, e.getMessage());
            return false;
        }
    }

    @Override
    public GenerationOutput generate(GenerationRequest request) {
        log.info("Generation started → {} ({}, {})", id, model, request.taskType());
        long start = System.currentTimeMillis();
        GenerationConstraints constraints = request.constraints();
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .maxTokens(constraints.maxTokens())
                .temperature(constraints.temperature() != null ? constraints.temperature() : temperature)
                .build();
        var spec = chatClient.prompt();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            spec = spec.system(request.systemPrompt());
        }
        String content = spec.user(request.userPrompt())
                .options(options)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("Generation complete → {} ({}s)", id, String.format("%.1f", elapsed / 1000.0));
        if (content == null || content.isBlank()) {
            throw new EmptyGenerationException(id, "Provider " + id + " returned empty content for "
                    + request.taskType() + ". Check that the model is running.");
        }
        return GenerationOutput.of(id, model, content, elapsed);
    }

    public String model() {
        return model;
    }

    public String baseUrl() {
        return baseUrl;
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
