package com.example.interview.model;

import java.util.List;

/**
 * Report entry for one answered question.
 */
public record QuestionFeedback(
        String label,
        QuestionType questionType,
        String question,
        String answer,
        Intent intent,
        String framework,
        Double normalizedScore,
        String feedback,
        List<String> strengths,
        List<String> improvements,
        String modelAnswer,
        List<String> failedStages
) {
    public QuestionFeedback {
        strengths = strengths != null ? List.copyOf(strengths) : List.of();
        improvements = improvements != null ? List.copyOf(improvements) : List.of();
        failedStages = failedStages != null ? List.copyOf(failedStages) : List.of();
    }
}
