package com.vcc.copilot.model;

/**
 * Effective model parameters for one upstream call, already clamped to tier ceilings.
 */
public record GenerationOptions(String model, int maxTokens, double temperature) {
}
