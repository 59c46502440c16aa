package com.taskflow.engine.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Completion service backed by an Ollama server's {@code /api/generate}
 * endpoint, called without streaming.
 */
public class OllamaCompletionService implements CompletionService {

    private static final Logger log = LoggerFactory.getLogger(OllamaCompletionService.class);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final double temperature;
    private final int maxTokens;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OllamaCompletionService(String baseUrl, String model, Duration timeout,
                                   double temperature, int maxTokens) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.timeout = timeout;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Completion complete(String prompt, String systemPrompt) {
        try {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("model", model);
            body.put("prompt", prompt);
            if (systemPrompt != null && !systemPrompt.isBlank()) {
                body.put("system", systemPrompt);
            }
            body.put("stream", false);
            ObjectNode options = body.putObject("options");
            options.put("temperature", temperature);
            options.put("num_predict", maxTokens);

            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.warn("Completion failed with status {}", response.statusCode());
                return Completion.failure("Completion request failed with status "
                    + response.statusCode() + ": " + response.body());
            }

            JsonNode result = objectMapper.readTree(response.body());
            if (result.hasNonNull("error")) {
                return Completion.failure(result.get("error").asText());
            }
            log.debug("Generated completion with model {}", model);
            return Completion.success(result.path("response").asText(""));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Completion.failure("Completion request interrupted");
        } catch (IOException | IllegalArgumentException e) {
            log.error("Error generating completion", e);
            return Completion.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
