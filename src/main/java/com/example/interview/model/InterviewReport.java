package com.example.interview.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Final report of a finished session. Archived in the {@code interview_reports} collection.
 *
 * @param sessionId        session id, also the document id
 * @param companyName      hiring company
 * @param jobTitle         role
 * @param overview         narrative summary
 * @param strengthsMatrix  strength themes with supporting turn labels
 * @param weaknessesMatrix weakness themes with supporting turn labels
 * @param scoreAggregation normalized averages
 * @param hiringDecision   hiring tier and rule trace
 * @param questionFeedback per-question feedback, in turn order
 * @param validationErrors referential and enum violations found while assembling
 * @param createdAt        assembly time
 */
@Document(collection = "interview_reports")
public record InterviewReport(
        @Id String sessionId,
        String companyName,
        String jobTitle,
        String overview,
        List<EvidenceTheme> strengthsMatrix,
        List<EvidenceTheme> weaknessesMatrix,
        ScoreAggregation scoreAggregation,
        HiringDecision hiringDecision,
        List<QuestionFeedback> questionFeedback,
        List<String> validationErrors,
        Instant createdAt
) {
    public InterviewReport {
        strengthsMatrix = strengthsMatrix != null ? List.copyOf(strengthsMatrix) : List.of();
        weaknessesMatrix = weaknessesMatrix != null ? List.copyOf(weaknessesMatrix) : List.of();
        questionFeedback = questionFeedback != null ? List.copyOf(questionFeedback) : List.of();
        validationErrors = validationErrors != null ? List.copyOf(validationErrors) : List.of();
    }

    public InterviewReport withOverview(String newOverview) {
        return new InterviewReport(sessionId, companyName, jobTitle, newOverview, strengthsMatrix, weaknessesMatrix,
                scoreAggregation, hiringDecision, questionFeedback, validationErrors, createdAt);
    }

    public boolean isValid() {
        return validationErrors.isEmpty();
    }
}
