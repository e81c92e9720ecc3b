package com.example.interview.model;

/**
 * Body of {@code POST /api/interview/start}. {@code plan} is optional; when absent a plan
 * is designed from the context.
 */
public record StartSessionRequest(
        String companyName,
        String jobTitle,
        String jobDescription,
        String resume,
        String competencyQuery,
        String language,
        String difficulty,
        String persona,
        InterviewPlan plan
) {
    public InterviewContext toContext() {
        return new InterviewContext(companyName, jobTitle, jobDescription, resume, competencyQuery,
                language, difficulty, InterviewerPersona.fromName(persona));
    }
}
