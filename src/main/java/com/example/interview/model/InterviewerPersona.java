package com.example.interview.model;

import java.util.Locale;

/**
 * Interviewer persona injected into evaluation and follow-up prompts.
 */
public enum InterviewerPersona {
    TEAM_LEAD(
            "A hands-on team lead who will work with the candidate daily.",
            "practical problem solving, ownership of concrete tasks, collaboration inside the team",
            "Asks about specific situations and the candidate's own actions; digs into details and numbers."),
    EXECUTIVE(
            "A senior executive judging long-term fit and business impact.",
            "business impact, strategic thinking, values and growth potential",
            "Asks open, big-picture questions; digs into reasoning, priorities and results.");

    private final String description;
    private final String evaluationFocus;
    private final String questionStyle;

    InterviewerPersona(String description, String evaluationFocus, String questionStyle) {
        this.description = description;
        this.evaluationFocus = evaluationFocus;
        this.questionStyle = questionStyle;
    }

    public String description() {
        return description;
    }

    public String evaluationFocus() {
        return evaluationFocus;
    }

    public String questionStyle() {
        return questionStyle;
    }

    public static InterviewerPersona fromName(String raw) {
        if (raw == null) return TEAM_LEAD;
        String key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return "EXECUTIVE".equals(key) ? EXECUTIVE : TEAM_LEAD;
    }
}
