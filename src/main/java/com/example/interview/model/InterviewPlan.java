package com.example.interview.model;

import java.util.List;

/**
 * The question plan of one session. Built once at session start, read-only afterwards.
 */
public record InterviewPlan(List<PlanPhase> phases) {

    public InterviewPlan {
        phases = phases != null ? List.copyOf(phases) : List.of();
    }

    public int phaseCount() {
        return phases.size();
    }

    public int itemCount(int phaseIndex) {
        return phaseIndex >= 0 && phaseIndex < phases.size() ? phases.get(phaseIndex).items().size() : 0;
    }

    public int totalItems() {
        return phases.stream().mapToInt(p -> p.items().size()).sum();
    }

    public PlanItem item(int phaseIndex, int questionIndex) {
        return phases.get(phaseIndex).items().get(questionIndex);
    }

    /** 1-based running number of the item across all phases; used as the main turn label. */
    public int ordinal(int phaseIndex, int questionIndex) {
        int n = 0;
        for (int p = 0; p < phaseIndex; p++) {
            n += itemCount(p);
        }
        return n + questionIndex + 1;
    }
}
