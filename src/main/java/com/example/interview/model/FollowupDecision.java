package com.example.interview.model;

import java.util.List;

/**
 * Follow-ups chosen for one answer.
 *
 * @param followups        0-2 follow-up questions, in asking order
 * @param templateFallback whether the fixed template pool replaced model output
 * @param reason           which rule fired
 */
public record FollowupDecision(List<String> followups, boolean templateFallback, String reason) {

    public FollowupDecision {
        followups = followups != null ? List.copyOf(followups) : List.of();
    }

    public static FollowupDecision none(String reason) {
        return new FollowupDecision(List.of(), false, reason);
    }

    public boolean isEmpty() {
        return followups.isEmpty();
    }
}
