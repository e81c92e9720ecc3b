package com.example.interview.model;

import java.util.List;

/**
 * Outcome of the hiring rule.
 *
 * @param recommendation tier
 * @param weighted       weighted 0-100 score the tier was derived from
 * @param gatesPassed    whether every applicable gate held
 * @param reasons        human-readable account of the rule evaluation
 */
public record HiringDecision(HiringRecommendation recommendation, double weighted,
                             boolean gatesPassed, List<String> reasons) {
    public HiringDecision {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }
}
