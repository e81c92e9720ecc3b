package com.example.interview.model;

import java.util.Locale;

/**
 * States of the interview flow. {@link #FINISHED} is terminal.
 */
public enum InterviewPhase {
    INTRO,
    CORE,
    WRAPUP,
    FINISHED;

    /** Maps a plan phase name ({@code intro}, {@code core}, {@code wrapup}) to its state. */
    public static InterviewPhase fromPhaseName(String name) {
        if (name == null) return CORE;
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "intro", "opening" -> INTRO;
            case "wrapup", "wrap_up", "closing" -> WRAPUP;
            default -> CORE;
        };
    }
}
