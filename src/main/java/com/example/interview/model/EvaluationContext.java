package com.example.interview.model;

import java.util.List;

/**
 * What the evaluator needs to know about the question besides its text.
 *
 * @param questionLabel   turn label of the question
 * @param questionType    type of the question
 * @param expectedPoints  points a complete answer covers
 * @param rubric          score bands of the item
 * @param interview       session context (company, role, resume, persona)
 * @param competencyHints grounding texts for scoring
 */
public record EvaluationContext(
        String questionLabel,
        QuestionType questionType,
        List<String> expectedPoints,
        List<RubricBand> rubric,
        InterviewContext interview,
        List<String> competencyHints
) {
    public EvaluationContext {
        if (questionType == null) questionType = QuestionType.UNKNOWN;
        if (interview == null) interview = new InterviewContext(null, null, null, null, null, null, null, null);
        expectedPoints = expectedPoints != null ? List.copyOf(expectedPoints) : List.of();
        rubric = rubric != null ? List.copyOf(rubric) : List.of();
        competencyHints = competencyHints != null ? List.copyOf(competencyHints) : List.of();
    }

    /** Framework assumed when identification fails, derived from the question type. */
    public Framework defaultFramework() {
        return switch (questionType) {
            case STAR -> Framework.STAR;
            case CASE -> Framework.CASE;
            case SYSTEM -> Framework.SYSTEMDESIGN;
            default -> Framework.COMPETENCY;
        };
    }
}
