package com.example.interview.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Every scorable element of every framework, with the aliases model output uses for it.
 * <p>
 * This is the single lookup table for score keys: abbreviations ({@code s/t/a/r}),
 * spelling variants ({@code tradeoffs}) and known typos ({@code stucture}) all resolve here.
 */
public enum ScoreElement {
    SITUATION("situation", false, "s"),
    TASK("task", false, "t"),
    ACTION("action", false, "a"),
    RESULT("result", false, "r"),
    COMPETENCY("competency", false, "comp"),
    BEHAVIOR("behavior", false, "behaviour", "b"),
    IMPACT("impact", false, "i"),
    PROBLEM("problem", false, "p"),
    STRUCTURE("structure", false, "stucture", "structuring"),
    ANALYSIS("analysis", false, "analyses"),
    RECOMMENDATION("recommendation", false, "recommend", "recommendations"),
    REQUIREMENTS("requirements", false, "requirement", "req"),
    TRADE_OFFS("trade_offs", false, "tradeoffs", "trade-offs", "tradeoff", "trade_off"),
    ARCHITECTURE("architecture", false, "arch"),
    RISKS("risks", false, "risk"),
    CHALLENGE("challenge", true, "c"),
    LEARNING("learning", true, "l"),
    METRICS("metrics", true, "m", "metric");

    /** Upper bound of a base element score. */
    public static final int MAX_MAIN = 20;
    /** Upper bound of an extension element score. */
    public static final int MAX_EXT = 10;

    private static final Map<String, ScoreElement> BY_KEY;

    static {
        Map<String, ScoreElement> table = new HashMap<>();
        for (ScoreElement element : values()) {
            table.put(element.key, element);
            table.put(element.name().toLowerCase(Locale.ROOT), element);
            for (String alias : element.aliases) {
                table.put(alias, element);
            }
        }
        BY_KEY = Collections.unmodifiableMap(table);
    }

    private final String key;
    private final boolean extension;
    private final List<String> aliases;

    ScoreElement(String key, boolean extension, String... aliases) {
        this.key = key;
        this.extension = extension;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean isExtension() {
        return extension;
    }

    public int maxScore() {
        return extension ? MAX_EXT : MAX_MAIN;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Resolves a raw key from model output (case and surrounding whitespace ignored).
     */
    public static Optional<ScoreElement> lookup(String raw) {
        if (raw == null) return Optional.empty();
        String key = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        return Optional.ofNullable(BY_KEY.get(key));
    }

    /** Extension elements only. */
    public static List<ScoreElement> extensions() {
        return List.of(CHALLENGE, LEARNING, METRICS);
    }
}
