package com.example.interview.model;

/**
 * Next question to ask, or {@code done} when the interview is over.
 *
 * @param label    turn label, {@code null} when done
 * @param question question text, {@code null} when done
 * @param type     question type, {@code null} when done
 * @param followup whether this is a follow-up of the current main question
 * @param done     no question left
 */
public record NextQuestion(String label, String question, QuestionType type, boolean followup, boolean done) {

    public static NextQuestion main(String label, String question, QuestionType type) {
        return new NextQuestion(label, question, type, false, false);
    }

    public static NextQuestion followup(String label, String question, QuestionType type) {
        return new NextQuestion(label, question, type, true, false);
    }

    public static NextQuestion finished() {
        return new NextQuestion(null, null, null, false, true);
    }
}
