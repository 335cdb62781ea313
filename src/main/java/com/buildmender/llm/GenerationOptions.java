package com.buildmender.llm;

import com.buildmender.config.BuildMenderProperties;

/**
 * Sampling settings passed with every generation call.
 */
public final class GenerationOptions {

    private final double temperature;
    private final int    maxTokens;
    private final int    contextWindow;

    public GenerationOptions(double temperature, int maxTokens, int contextWindow) {
        if (maxTokens <= 0 || contextWindow <= 0) {
            throw new IllegalArgumentException("maxTokens and contextWindow must be positive");
        }
        this.temperature   = temperature;
        this.maxTokens     = maxTokens;
        this.contextWindow = contextWindow;
    }

    public static GenerationOptions from(BuildMenderProperties.Oracle oracle) {
        return new GenerationOptions(oracle.getTemperature(), oracle.getMaxTokens(), oracle.getContextWindow());
    }

    public double getTemperature()   { return temperature; }
    public int    getMaxTokens()     { return maxTokens; }
    public int    getContextWindow() { return contextWindow; }

    @Override
    public String toString() {
        return String.format("GenerationOptions{temperature=%.2f, maxTokens=%d, contextWindow=%d}",
                temperature, maxTokens, contextWindow);
    }
}
