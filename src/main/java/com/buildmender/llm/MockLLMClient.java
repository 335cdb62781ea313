package com.buildmender.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    @Override
    public String generate(String prompt, GenerationOptions options) {
        // Stub: never proposes an edit, so offline runs end after one attempt
        return """
                Observation: Mock oracle, no model behind it.
                Thought: Nothing to suggest.
                Error_Type: UNKNOWN
                Target_File: gradle.properties
                Fix_Content: NO_FIX
                """;
    }
}
