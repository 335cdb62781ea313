package com.buildmender.llm;

import com.buildmender.config.BuildMenderProperties;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Profile;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * OllamaLLMClient - default LLMClient backed by a local Ollama server.
 *
 * Sampling settings travel in the request's "options" object
 * (temperature, num_predict, num_ctx). Connect and read timeouts follow
 * buildmender.repair.oracle-timeout.
 */
@Component
@Profile("!gemini & !mock")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    private final String baseUrl;
    private final String model;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public OllamaLLMClient(
            @Value("${ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${ollama.model:nous-hermes2-mistral:7b}") String model,
            RestTemplateBuilder restTemplateBuilder,
            BuildMenderProperties properties
    ) {
        this(baseUrl, model, restTemplate(restTemplateBuilder, properties.getRepair().getOracleTimeout()));
    }

    OllamaLLMClient(String baseUrl, String model, RestTemplate restTemplate) {
        this.baseUrl = baseUrl;
        this.model = model;
        this.restTemplate = restTemplate;
    }

    /** Connect and read are both bounded by the oracle timeout. */
    static RestTemplate restTemplate(RestTemplateBuilder builder, Duration timeout) {
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Override
    public String generate(String prompt, GenerationOptions options) {
        log.debug("[Ollama] model={} {} promptLen={}", model, options, prompt.length());

        try {
            String url = baseUrl + "/api/generate";

            Map<String, Object> sampling = new HashMap<>();
            sampling.put("temperature", options.getTemperature());
            sampling.put("num_predict", options.getMaxTokens());
            sampling.put("num_ctx",     options.getContextWindow());

            Map<String, Object> body = new HashMap<>();
            body.put("model",   model);
            body.put("prompt",  prompt);
            body.put("stream",  false);
            body.put("options", sampling);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody());

            String result = root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (Exception e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new IllegalStateException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }
}
