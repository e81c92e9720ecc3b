package com.example.interview.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Classification of a candidate reply. Only {@link #ANSWER} runs the full evaluation chain.
 * {@link #UNKNOWN} marks a label the classifier produced but the engine does not recognize.
 */
public enum Intent {
    ANSWER,
    IRRELEVANT,
    QUESTION,
    CLARIFICATION_REQUEST,
    CANNOT_ANSWER,
    UNKNOWN;

    /** Whether the reply is evaluated as an answer (unrecognized labels get the benefit of the doubt). */
    public boolean isEvaluated() {
        return this == ANSWER || this == UNKNOWN;
    }

    /**
     * Parses a classifier label. A blank label defaults to {@link #ANSWER}.
     */
    @JsonCreator
    public static Intent fromLabel(String raw) {
        if (raw == null || raw.isBlank()) return ANSWER;
        String key = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (Intent intent : values()) {
            if (intent.name().equals(key)) return intent;
        }
        return UNKNOWN;
    }
}
