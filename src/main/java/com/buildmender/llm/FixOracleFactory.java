package com.buildmender.llm;

import com.buildmender.config.BuildMenderProperties;

import org.springframework.stereotype.Component;

/**
 * Builds a fresh LlmFixOracle per repair request from the active LLMClient and
 * the configured generation settings. The caller closes it.
 */
@Component
public class FixOracleFactory {

    private final LLMClient client;
    private final BuildMenderProperties properties;

    public FixOracleFactory(LLMClient client, BuildMenderProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public LlmFixOracle create() {
        return new LlmFixOracle(
                client,
                GenerationOptions.from(properties.getOracle()),
                properties.getRepair().getOracleTimeout());
    }
}
