package com.example.interview.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Answer-structuring rubric with its declared base elements.
 */
public enum Framework {
    STAR("star", ScoreElement.SITUATION, ScoreElement.TASK, ScoreElement.ACTION, ScoreElement.RESULT),
    COMPETENCY("competency", ScoreElement.COMPETENCY, ScoreElement.BEHAVIOR, ScoreElement.IMPACT),
    CASE("case", ScoreElement.PROBLEM, ScoreElement.STRUCTURE, ScoreElement.ANALYSIS, ScoreElement.RECOMMENDATION),
    SYSTEMDESIGN("systemdesign", ScoreElement.REQUIREMENTS, ScoreElement.TRADE_OFFS,
            ScoreElement.ARCHITECTURE, ScoreElement.RISKS);

    private final String key;
    private final List<ScoreElement> elements;

    Framework(String key, ScoreElement... elements) {
        this.key = key;
        this.elements = List.of(elements);
    }

    @JsonValue
    public String key() {
        return key;
    }

    public List<ScoreElement> elements() {
        return elements;
    }

    /** Sum of the base element maxima: 20 per element. */
    public int maxMainScore() {
        return ScoreElement.MAX_MAIN * elements.size();
    }

    public List<String> elementKeys() {
        return elements.stream().map(ScoreElement::key).toList();
    }

    /**
     * Resolves a framework name. {@code system}, {@code system_design} and {@code mece}
     * are accepted as aliases.
     */
    public static Optional<Framework> lookup(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String key = raw.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "").replace(" ", "");
        return switch (key) {
            case "star" -> Optional.of(STAR);
            case "competency", "competencybased" -> Optional.of(COMPETENCY);
            case "case", "mece", "casemece" -> Optional.of(CASE);
            case "systemdesign", "system" -> Optional.of(SYSTEMDESIGN);
            default -> Optional.empty();
        };
    }
}
