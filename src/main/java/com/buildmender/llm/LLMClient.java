package com.buildmender.llm;

/**
 * LLMClient - transport to one text-generation backend.
 *
 * Implementations only move a prompt to the model and text back. Prompt
 * wording and response parsing belong to LlmFixOracle and FixResponseParser.
 * The active implementation is picked by Spring profile:
 *   default → OllamaLLMClient
 *   gemini  → GeminiLLMClient
 *   mock    → MockLLMClient
 */
public interface LLMClient {

    /**
     * @param prompt  full prompt text
     * @param options sampling and size limits for this call
     * @return raw model output; never null, empty string on empty model output
     * @throws RuntimeException on transport or protocol failure
     */
    String generate(String prompt, GenerationOptions options);
}
