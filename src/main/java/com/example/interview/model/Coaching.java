package com.example.interview.model;

import java.util.List;

/**
 * Coaching output: each strength and improvement quotes the answer.
 */
public record Coaching(List<String> strengths, List<String> improvements, String feedback) {

    public Coaching {
        strengths = strengths != null ? List.copyOf(strengths) : List.of();
        improvements = improvements != null ? List.copyOf(improvements) : List.of();
        if (feedback == null) feedback = "";
    }

    public static Coaching empty() {
        return new Coaching(List.of(), List.of(), "");
    }

    public Coaching withFeedback(String newFeedback) {
        return new Coaching(strengths, improvements, newFeedback);
    }
}
