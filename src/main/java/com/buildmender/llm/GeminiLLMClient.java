package com.buildmender.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.Random;

/**
 * GeminiLLMClient - LLMClient for the Gemini generateContent endpoint.
 *
 * GenerationOptions map onto generationConfig (temperature, maxOutputTokens).
 * The API key travels in the x-goog-api-key header. Overload answers
 * (503, 429) and I/O errors are retried with exponential backoff; any
 * other failure is thrown as IllegalStateException.
 */
@Component
@Profile("gemini")
public class GeminiLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiLLMClient.class);

    static final String API_KEY_HEADER = "x-goog-api-key";

    private static final int  MAX_RETRIES     = 3;
    private static final long BASE_BACKOFF_MS = 500;
    private static final long MAX_JITTER_MS   = 250;

    private final WebClient    webClient;
    private final String       apiKey;
    private final String       model;
    private final String       baseUrl;
    private final Duration     requestTimeout;
    private final long         baseBackoffMs;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Random       jitterRandom = new Random();

    @Autowired
    public GeminiLLMClient(
            WebClient.Builder builder,
            @Value("${gemini.api.key}") String apiKey,
            @Value("${gemini.api.model:gemini-1.5-flash}") String model,
            @Value("${gemini.api.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl,
            @Value("${gemini.api.request-timeout:60s}") Duration requestTimeout
    ) {
        this(builder.build(), apiKey, model, baseUrl, requestTimeout, BASE_BACKOFF_MS);
    }

    GeminiLLMClient(WebClient webClient, String apiKey, String model, String baseUrl,
                    Duration requestTimeout, long baseBackoffMs) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("gemini.api.key is not set");
        }
        this.webClient      = webClient;
        this.apiKey         = apiKey;
        this.model          = model;
        this.baseUrl        = baseUrl;
        this.requestTimeout = requestTimeout;
        this.baseBackoffMs  = baseBackoffMs;
    }

    @Override
    public String generate(String prompt, GenerationOptions options) {

        log.debug("[Gemini] model={} {} promptLen={}", model, options, prompt.length());

        String body = buildRequestBody(prompt, options);
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                String response = webClient
                        .post()
                        .uri(baseUrl + "/models/" + model + ":generateContent")
                        .header(API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(String.class)
                        .timeout(requestTimeout)
                        .block();

                String text = extractText(response);
                log.debug("[Gemini] responseLen={} retries={}", text.length(), attempt - 1);
                return text;

            } catch (RuntimeException ex) {

                if (!isRetryable(ex) || attempt > MAX_RETRIES) {
                    log.error("[Gemini] Call failed after {} attempt(s): {}", attempt, rootMessage(ex));
                    throw ex instanceof IllegalStateException
                            ? ex
                            : new IllegalStateException("Gemini LLM call failed: " + rootMessage(ex), ex);
                }

                long backoff = computeBackoff(attempt);
                log.warn("[Gemini] Transient failure on attempt {}, retrying in {} ms: {}",
                        attempt, backoff, rootMessage(ex));

                if (!sleep(backoff)) {
                    throw new IllegalStateException("Interrupted while backing off", ex);
                }
            }
        }
    }

    String buildRequestBody(String prompt, GenerationOptions options) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putArray("contents")
            .addObject()
            .putArray("parts")
            .addObject()
            .put("text", prompt);

        root.putObject("generationConfig")
            .put("temperature", options.getTemperature())
            .put("maxOutputTokens", options.getMaxTokens());

        return root.toString();
    }

    /** First text part of the first candidate; empty when the candidate has no parts. */
    String extractText(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response == null ? "" : response);
        } catch (IOException e) {
            throw new IllegalStateException("Malformed Gemini response", e);
        }

        JsonNode candidate = root == null ? null : root.path("candidates").path(0);
        if (candidate == null || candidate.isMissingNode()) {
            throw new IllegalStateException("Gemini response has no candidates: " + response);
        }
        return candidate.path("content").path("parts").path(0).path("text").asText("");
    }

    private boolean isRetryable(RuntimeException ex) {
        return ex instanceof WebClientResponseException.ServiceUnavailable
            || ex instanceof WebClientResponseException.TooManyRequests
            || ex.getCause() instanceof IOException;
    }

    private long computeBackoff(int attempt) {
        long exponential = baseBackoffMs * (1L << (attempt - 1));
        long jitter = baseBackoffMs == 0 ? 0 : (long) (jitterRandom.nextDouble() * (MAX_JITTER_MS + 1));
        return exponential + jitter;
    }

    /** @return false if interrupted; the interrupt flag is restored */
    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
