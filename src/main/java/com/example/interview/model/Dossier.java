package com.example.interview.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured evaluation of one candidate answer.
 *
 * @param questionLabel turn label of the question (e.g. {@code "2"} or {@code "2-1"})
 * @param questionType  type tag of the question
 * @param intent        classified intent
 * @param framework     applied framework and extension flags, {@code null} when not evaluated
 * @param extracted     framework component summaries, only declared keys
 * @param scoresMain    0-20 per base element
 * @param scoresExt     0-10 per extension element
 * @param scoringReason scorer rationale
 * @param explanation   per-element score explanation, {@code null} when unavailable
 * @param coaching      strengths, improvements and feedback
 * @param modelAnswer   exemplar answer, {@code null} when unavailable
 * @param biasIssues    issues found by the bias filter
 * @param stageErrors   failed stages and their error message
 */
public record Dossier(
        String questionLabel,
        QuestionType questionType,
        Intent intent,
        FrameworkSelection framework,
        Map<String, String> extracted,
        Map<ScoreElement, Integer> scoresMain,
        Map<ScoreElement, Integer> scoresExt,
        String scoringReason,
        ScoreExplanation explanation,
        Coaching coaching,
        ModelAnswer modelAnswer,
        List<BiasIssue> biasIssues,
        Map<EvaluationStage, String> stageErrors
) {
    public Dossier {
        if (questionType == null) questionType = QuestionType.UNKNOWN;
        if (intent == null) intent = Intent.ANSWER;
        extracted = extracted != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extracted)) : Map.of();
        scoresMain = immutableScores(scoresMain);
        scoresExt = immutableScores(scoresExt);
        if (scoringReason == null) scoringReason = "";
        if (coaching == null) coaching = Coaching.empty();
        biasIssues = biasIssues != null ? List.copyOf(biasIssues) : List.of();
        stageErrors = stageErrors == null || stageErrors.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(stageErrors));
    }

    /** Dossier of a reply that was not evaluated (non-answer intent). */
    public static Dossier intentOnly(String questionLabel, QuestionType type, Intent intent,
                                     Map<EvaluationStage, String> stageErrors) {
        return new Dossier(questionLabel, type, intent, null, null, null, null, null,
                null, null, null, null, stageErrors);
    }

    public boolean hasScores() {
        return framework != null && !scoresMain.isEmpty();
    }

    public boolean failed(EvaluationStage stage) {
        return stageErrors.containsKey(stage);
    }

    public int totalMain() {
        return scoresMain.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Dossier withQuestionLabel(String label) {
        return new Dossier(label, questionType, intent, framework, extracted, scoresMain, scoresExt,
                scoringReason, explanation, coaching, modelAnswer, biasIssues, stageErrors);
    }

    private static Map<ScoreElement, Integer> immutableScores(Map<ScoreElement, Integer> scores) {
        if (scores == null || scores.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new EnumMap<>(scores));
    }
}
