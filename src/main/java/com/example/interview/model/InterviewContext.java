package com.example.interview.model;

/**
 * Context bundle of one session.
 *
 * @param companyName     hiring company
 * @param jobTitle        role the candidate applies for
 * @param jobDescription  job posting text
 * @param resume          candidate resume text
 * @param competencyQuery query used for the competency hint lookup
 * @param language        interview language (e.g. {@code en}, {@code ko})
 * @param difficulty      {@code easy}, {@code normal} or {@code hard}
 * @param persona         interviewer persona
 */
public record InterviewContext(
        String companyName,
        String jobTitle,
        String jobDescription,
        String resume,
        String competencyQuery,
        String language,
        String difficulty,
        InterviewerPersona persona
) {
    public InterviewContext {
        if (companyName == null || companyName.isBlank()) companyName = "the company";
        if (jobTitle == null || jobTitle.isBlank()) jobTitle = "this role";
        if (jobDescription == null) jobDescription = "";
        if (resume == null) resume = "";
        if (competencyQuery == null || competencyQuery.isBlank()) competencyQuery = jobTitle;
        if (language == null || language.isBlank()) language = "en";
        if (difficulty == null || difficulty.isBlank()) difficulty = "normal";
        if (persona == null) persona = InterviewerPersona.TEAM_LEAD;
    }

    /** Copy with every field clipped to {@code maxChars}. */
    public InterviewContext clipped(int maxChars) {
        return new InterviewContext(companyName, jobTitle, clip(jobDescription, maxChars),
                clip(resume, maxChars), competencyQuery, language, difficulty, persona);
    }

    private static String clip(String s, int max) {
        return s != null && s.length() > max ? s.substring(0, max) : s;
    }
}
