package com.example.interview.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Type tag of a plan item. Drives follow-up rules and whether the answer is scored.
 */
public enum QuestionType {
    ICEBREAKING("icebreaking"),
    SELF_INTRO("self_intro"),
    MOTIVATION("motivation"),
    STAR("star"),
    COMPETENCY("competency"),
    CASE("case"),
    SYSTEM("system"),
    HARD("hard"),
    WRAPUP("wrapup"),
    UNKNOWN("unknown");

    private final String tag;

    QuestionType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /** Icebreaking, self introduction and motivation get soft follow-ups only. */
    public boolean isLightweight() {
        return this == ICEBREAKING || this == SELF_INTRO || this == MOTIVATION;
    }

    /** Icebreaking and wrap-up turns, and unrecognized tags, never enter the score aggregation. */
    public boolean isScored() {
        return this != ICEBREAKING && this != WRAPUP && this != UNKNOWN;
    }

    /**
     * Parses a plan tag. Accepts a few spellings seen in generated plans
     * ({@code "self-intro"}, {@code "intro"}, {@code "systemdesign"}).
     * Unrecognized or blank tags map to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static QuestionType fromTag(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (key) {
            case "icebreaking", "icebreak", "ice_breaking" -> ICEBREAKING;
            case "self_intro", "intro", "selfintro", "self_introduction" -> SELF_INTRO;
            case "motivation", "motive" -> MOTIVATION;
            case "star", "behavioral" -> STAR;
            case "competency" -> COMPETENCY;
            case "case", "mece" -> CASE;
            case "system", "systemdesign", "system_design" -> SYSTEM;
            case "hard", "deep_dive" -> HARD;
            case "wrapup", "wrap_up", "closing" -> WRAPUP;
            default -> UNKNOWN;
        };
    }
}
