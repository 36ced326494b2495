package com.vcc.copilot.model;

/**
 * Parsed completion returned by the language model.
 */
public record GenerationResult(String text, String model, int tokensUsed, String finishReason) {
}
