package com.example.interview.model;

import java.util.List;

/**
 * Ordered group of plan items.
 *
 * @param name  {@code intro}, {@code core} or {@code wrapup}
 * @param items ordered main questions
 */
public record PlanPhase(String name, List<PlanItem> items) {
    public PlanPhase {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public InterviewPhase state() {
        return InterviewPhase.fromPhaseName(name);
    }
}
