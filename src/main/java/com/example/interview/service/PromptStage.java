package com.example.interview.service;

/**
 * A named prompt template with its sampling settings.
 *
 * @param name        stage name, used in logs and error markers
 * @param template    template text with {@code {variable}} placeholders
 * @param temperature sampling temperature
 * @param maxTokens   completion budget
 */
public record PromptStage(String name, String template, double temperature, int maxTokens) {}
