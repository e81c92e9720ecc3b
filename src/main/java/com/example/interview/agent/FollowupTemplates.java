package com.example.interview.agent;

import com.example.interview.model.QuestionType;

import java.util.List;

/**
 * Fixed follow-up pools used when model generation is unavailable, and the bridge
 * phrases between main questions. {@code {company}} and {@code {role}} are filled in.
 */
final class FollowupTemplates {

    private FollowupTemplates() {
    }

    static final List<String> ICEBREAKING = List.of(
            "How has your day been so far",
            "Was it easy to find time for today's interview",
            "What did you do to get ready for today");

    static final List<String> SELF_INTRO = List.of(
            "Could you add one experience that best shows who you are",
            "Which of your strengths would your last team mention first",
            "What would you like us to remember about you after today");

    static final List<String> MOTIVATION = List.of(
            "What made you choose {company} among the companies you looked at",
            "Which part of the {role} role do you want to grow in first",
            "What do you expect to contribute to {company} in your first year as {role}");

    static final List<String> SUBSTANTIVE = List.of(
            "What were the key metrics, with their baseline and period",
            "What was your own decision there, and what was the rationale",
            "What were the main risks, and what was your plan B",
            "How would you apply that experience to the {role} role at {company}",
            "What would you do differently if you faced the same situation again");

    static final List<String> EVIDENCE = List.of(
            "Can you give one concrete example where you actually showed that",
            "What is a specific situation, with results, that backs that up",
            "Which past project proves that best, and what exactly did you do");

    static final List<String> TRANSITIONS = List.of(
            "Thank you. Let's move on to the next question.",
            "Understood. Next, I'd like to ask about something else.",
            "Thanks for the answer. Let's continue.",
            "Good. Let's look at a different topic now.");

    static List<String> softPool(QuestionType type) {
        return switch (type) {
            case ICEBREAKING -> ICEBREAKING;
            case SELF_INTRO -> SELF_INTRO;
            case MOTIVATION -> MOTIVATION;
            default -> SUBSTANTIVE;
        };
    }

    /** Appends a question mark unless the text already ends in one. */
    static String ensureQuestionMark(String s) {
        String t = s == null ? "" : s.strip();
        if (t.isEmpty() || t.endsWith("?") || t.endsWith("？")) return t;
        while (t.endsWith(".") || t.endsWith("!")) {
            t = t.substring(0, t.length() - 1);
        }
        return t + "?";
    }
}
