package com.example.interview.model;

/**
 * A span flagged by the bias filter. Kept on the dossier for audit.
 *
 * @param source       {@code coaching} or {@code model_answer}
 * @param span         offending text
 * @param category     e.g. gender, age, origin
 * @param reason       why it was flagged
 * @param suggestedFix replacement wording
 * @param severity     low, medium or high
 */
public record BiasIssue(String source, String span, String category, String reason,
                        String suggestedFix, String severity) {}
