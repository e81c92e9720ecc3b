package com.example.interview.orchestrator;

import com.example.interview.model.Intent;

import java.util.regex.Pattern;

/**
 * Scripted interviewer replies for candidate turns that are not answers.
 */
final class RecoveryPrompts {

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.?!。？])\\s+");
    private static final Pattern PREAMBLE = Pattern.compile(
            "^(?:thank you|thanks|good|great|okay|ok|alright|now|next)[,.!]?\\s+", Pattern.CASE_INSENSITIVE);

    private RecoveryPrompts() {
    }

    static String forIntent(Intent intent, String lastQuestion) {
        String core = coreOf(lastQuestion);
        return switch (intent) {
            case CLARIFICATION_REQUEST -> "Let me rephrase the question. In short: " + core;
            case IRRELEVANT -> "That seems a little off the topic. Let's come back to the question: " + core;
            case QUESTION -> "Good question. Let's keep it for the end of the interview. For now: " + core;
            case CANNOT_ANSWER -> "That's all right. Let's move on to the next question.";
            default -> core;
        };
    }

    /**
     * The question sentence of an interviewer turn: the last sentence ending in a question
     * mark, without courtesy preamble.
     */
    static String coreOf(String question) {
        if (question == null || question.isBlank()) return "";
        String[] sentences = SENTENCE_END.split(question.strip());
        String core = sentences[sentences.length - 1];
        for (int i = sentences.length - 1; i >= 0; i--) {
            if (sentences[i].endsWith("?") || sentences[i].endsWith("？")) {
                core = sentences[i];
                break;
            }
        }
        String stripped = PREAMBLE.matcher(core).replaceFirst("");
        if (stripped.isEmpty()) return core;
        return Character.toUpperCase(stripped.charAt(0)) + stripped.substring(1);
    }
}
