package com.example.interview.service;

/**
 * Text completion capability used by every prompt stage.
 * <p>
 * Implementations retry transient provider failures themselves and throw
 * {@link LlmUnavailableException} once the retry budget is exhausted.
 */
@FunctionalInterface
public interface LlmClient {

    /**
     * Sends a prompt and returns the raw model text (possibly malformed JSON).
     *
     * @param prompt      full prompt text
     * @param temperature sampling temperature
     * @param maxTokens   completion budget
     * @return model output, never {@code null}
     */
    String call(String prompt, double temperature, int maxTokens);
}
