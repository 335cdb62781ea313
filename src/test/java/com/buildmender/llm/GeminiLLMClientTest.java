package com.buildmender.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GeminiLLMClientTest {

    private static final String ANSWER = """
            {"candidates":[{"content":{"parts":[{"text":"Fix_Content: NO_FIX"}]}}]}
            """;

    private final List<ClientRequest> requests = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();

    private GeminiLLMClient client(HttpStatus... statuses) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    bodies.add(bodyOf(request));
                    HttpStatus status = statuses[Math.min(requests.size(), statuses.length) - 1];
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(status.is2xxSuccessful() ? ANSWER : "{\"error\":{\"code\":" + status.value() + "}}")
                            .build());
                })
                .build();
        return new GeminiLLMClient(webClient, "secret-key", "gemini-test",
                "https://gemini.example/v1beta", Duration.ofSeconds(5), 0);
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest captured = new MockClientHttpRequest(HttpMethod.POST, request.url());
        request.body().insert(captured, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return captured.getBodyAsString().block();
    }

    @Test
    void testGenerationOptionsReachGenerationConfig() throws Exception {
        String result = client(HttpStatus.OK).generate("fix my build", new GenerationOptions(0.25, 777, 4096));

        assertEquals("Fix_Content: NO_FIX", result);
        assertEquals(1, requests.size());

        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("https://gemini.example/v1beta/models/gemini-test:generateContent", request.url().toString());
        assertEquals("secret-key", request.headers().getFirst(GeminiLLMClient.API_KEY_HEADER));

        JsonNode body = new ObjectMapper().readTree(bodies.get(0));
        assertEquals(0.25, body.path("generationConfig").path("temperature").asDouble());
        assertEquals(777, body.path("generationConfig").path("maxOutputTokens").asInt());
        assertEquals("fix my build", body.path("contents").path(0).path("parts").path(0).path("text").asText());
    }

    @Test
    void testServiceUnavailableIsRetried() {
        GeminiLLMClient client = client(HttpStatus.SERVICE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, HttpStatus.OK);

        String result = client.generate("prompt", new GenerationOptions(0.7, 2048, 4096));

        assertEquals("Fix_Content: NO_FIX", result);
        assertEquals(3, requests.size());
    }

    @Test
    void testRetriesAreBounded() {
        GeminiLLMClient client = client(HttpStatus.TOO_MANY_REQUESTS);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> client.generate("prompt", new GenerationOptions(0.7, 2048, 4096)));

        assertInstanceOf(WebClientResponseException.TooManyRequests.class, e.getCause());
        assertEquals(4, requests.size());
    }

    @Test
    void testBadRequestIsNotRetried() {
        GeminiLLMClient client = client(HttpStatus.BAD_REQUEST);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> client.generate("prompt", new GenerationOptions(0.7, 2048, 4096)));

        assertInstanceOf(WebClientResponseException.BadRequest.class, e.getCause());
        assertEquals(1, requests.size());
    }

    @Test
    void testResponseWithoutCandidatesRejected() {
        GeminiLLMClient client = client(HttpStatus.OK);

        assertThrows(IllegalStateException.class, () -> client.extractText("{\"promptFeedback\":{}}"));
        assertEquals("", client.extractText("{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}"));
    }

    @Test
    void testBlankApiKeyRejected() {
        assertThrows(IllegalStateException.class, () -> new GeminiLLMClient(WebClient.create(), " ", "m",
                "https://gemini.example/v1beta", Duration.ofSeconds(5), 0));
    }
}
