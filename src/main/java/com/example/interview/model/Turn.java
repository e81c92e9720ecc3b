package com.example.interview.model;

import java.time.Instant;

/**
 * One message of the interview transcript.
 *
 * @param label        {@code "2"} for main question 2, {@code "2-1"} for its first follow-up
 * @param role         who spoke
 * @param text         question or answer text
 * @param questionType type of the question this turn belongs to
 * @param dossier      evaluation of a candidate turn, {@code null} for interviewer turns
 * @param createdAt    creation time
 */
public record Turn(String label, TurnRole role, String text, QuestionType questionType,
                   Dossier dossier, Instant createdAt) {

    public static Turn interviewer(String label, String question, QuestionType type) {
        return new Turn(label, TurnRole.INTERVIEWER, question, type, null, Instant.now());
    }

    public static Turn candidate(String label, String answer, QuestionType type, Dossier dossier) {
        return new Turn(label, TurnRole.CANDIDATE, answer, type, dossier, Instant.now());
    }

    public Turn withDossier(Dossier newDossier) {
        return new Turn(label, role, text, questionType, newDossier, createdAt);
    }
}
