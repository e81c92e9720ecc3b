package com.example.interview.service;

import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Default {@link ThemeClassifier}: a keyword table over the coach's own words.
 * Quoted answer fragments are ignored so the candidate's vocabulary does not decide
 * the theme. Sentences matching no keyword are keyed by their first words.
 */
@Service
public class KeywordThemeClassifier implements ThemeClassifier {

    private static final int FALLBACK_WORDS = 4;

    private static final Pattern QUOTED = Pattern.compile("\"[^\"]*\"|“[^”]*”|'[^']{4,}'");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]+");

    /** First match wins. */
    private static final Map<String, Pattern> THEMES = new LinkedHashMap<>();

    static {
        THEMES.put("Quantified results", keywords("metric", "kpi", "number", "quantif", "measur", "%", "수치", "지표", "정량"));
        THEMES.put("Ownership", keywords("ownership", "own decision", "initiative", "took the lead", "led ", "주도", "책임"));
        THEMES.put("Collaboration", keywords("team", "collaborat", "stakeholder", "cooperat", "협업", "팀"));
        THEMES.put("Structured thinking", keywords("structur", "logic", "framework", "step by step", "mece", "논리", "구조"));
        THEMES.put("Problem solving", keywords("problem", "solv", "root cause", "debug", "troubleshoot", "문제", "해결"));
        THEMES.put("Learning and growth", keywords("learn", "lesson", "grow", "reflect", "배움", "성장", "교훈"));
        THEMES.put("Technical depth", keywords("architect", "technical", "design", "scal", "performance", "기술", "설계"));
        THEMES.put("Communication", keywords("communicat", "explain", "clear", "concise", "설명", "전달", "소통"));
        THEMES.put("Specificity", keywords("specific", "concrete", "example", "detail", "vague", "구체", "사례"));
        THEMES.put("Motivation and fit", keywords("motivat", "passion", "company", "fit", "지원 동기", "열정"));
    }

    @Override
    public String themeOf(String sentence) {
        if (sentence == null || sentence.isBlank()) return "General";
        String commentary = QUOTED.matcher(sentence).replaceAll(" ").toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> theme : THEMES.entrySet()) {
            if (theme.getValue().matcher(commentary).find()) return theme.getKey();
        }
        String phrase = Arrays.stream(NON_WORD.matcher(commentary).replaceAll(" ").trim().split("\\s+"))
                .filter(w -> !w.isEmpty())
                .limit(FALLBACK_WORDS)
                .collect(Collectors.joining(" "));
        if (phrase.isEmpty()) return "General";
        return Character.toUpperCase(phrase.charAt(0)) + phrase.substring(1);
    }

    private static Pattern keywords(String... words) {
        String alternation = Arrays.stream(words).map(Pattern::quote).collect(Collectors.joining("|"));
        return Pattern.compile(alternation);
    }
}
