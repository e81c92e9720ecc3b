package com.example.interview.model;

import java.util.List;

/**
 * A main question of the interview plan.
 *
 * @param id             stable item id (e.g. {@code core-2})
 * @param type           question type tag
 * @param question       question text
 * @param expectedPoints points a complete answer is expected to cover
 * @param rubric         discrete score bands
 */
public record PlanItem(
        String id,
        QuestionType type,
        String question,
        List<String> expectedPoints,
        List<RubricBand> rubric
) {
    public PlanItem {
        if (type == null) type = QuestionType.UNKNOWN;
        if (question == null) question = "";
        expectedPoints = expectedPoints != null ? List.copyOf(expectedPoints) : List.of();
        rubric = rubric != null ? List.copyOf(rubric) : List.of();
    }

    public static PlanItem of(String id, QuestionType type, String question) {
        return new PlanItem(id, type, question, List.of(), List.of());
    }
}
