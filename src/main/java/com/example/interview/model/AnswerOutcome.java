package com.example.interview.model;

import java.util.List;

/**
 * Outcome of a submitted answer.
 *
 * @param label            label of the answered question
 * @param analysis         evaluation dossier, {@code null} when the session was already finished
 * @param recoveryPrompt   scripted reply for non-answer intents
 * @param followups        follow-ups queued by this answer
 * @param templateFallback whether the follow-ups came from the template pool
 * @param transitionPhrase bridge sentence when the next question is a new main question
 * @param nextQuestionHint preview of the next question, {@code null} at the end
 * @param done             the session accepts no more answers
 */
public record AnswerOutcome(
        String label,
        Dossier analysis,
        String recoveryPrompt,
        List<String> followups,
        boolean templateFallback,
        String transitionPhrase,
        String nextQuestionHint,
        boolean done
) {
    public AnswerOutcome {
        followups = followups != null ? List.copyOf(followups) : List.of();
    }

    public static AnswerOutcome finished() {
        return new AnswerOutcome(null, null, null, List.of(), false, null, null, true);
    }
}
