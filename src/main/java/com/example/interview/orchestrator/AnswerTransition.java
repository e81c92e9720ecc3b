package com.example.interview.orchestrator;

import java.util.List;

/**
 * Effect of a candidate reply on the flow.
 *
 * @param recoveryPrompt scripted reply for non-answers, {@code null} for answers
 * @param enqueued       follow-ups accepted into the pending queue
 * @param done           the session was already finished
 */
public record AnswerTransition(String recoveryPrompt, List<String> enqueued, boolean done) {

    public AnswerTransition {
        enqueued = enqueued != null ? List.copyOf(enqueued) : List.of();
    }

    static AnswerTransition finished() {
        return new AnswerTransition(null, List.of(), true);
    }
}
