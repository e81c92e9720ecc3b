package com.example.interview.model;

import java.util.List;

/**
 * Row of a strengths or weaknesses matrix.
 *
 * @param theme    short theme label
 * @param evidence turn labels that support the theme, deduplicated
 * @param examples the coaching sentences grouped under the theme
 */
public record EvidenceTheme(String theme, List<String> evidence, List<String> examples) {
    public EvidenceTheme {
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        examples = examples != null ? List.copyOf(examples) : List.of();
    }
}
