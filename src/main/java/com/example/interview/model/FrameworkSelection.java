package com.example.interview.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Framework chosen for an answer plus the extension elements it showed evidence of.
 *
 * @param framework  base framework
 * @param extensions present extension elements (challenge, learning, metrics)
 */
public record FrameworkSelection(Framework framework, Set<ScoreElement> extensions) {

    public FrameworkSelection {
        if (framework == null) framework = Framework.COMPETENCY;
        extensions = extensions == null || extensions.isEmpty()
                ? Set.of()
                : Set.copyOf(extensions);
    }

    /**
     * Parses an identifier label such as {@code "STAR+C+M"}. The base is the part before the
     * first {@code +}; unknown bases fall back to {@code fallback}, unknown flags are ignored.
     */
    public static FrameworkSelection parse(String label, Framework fallback) {
        if (label == null || label.isBlank()) return new FrameworkSelection(fallback, Set.of());
        String[] parts = label.trim().split("\\+");
        Framework base = Framework.lookup(parts[0]).orElse(fallback);
        Set<ScoreElement> ext = EnumSet.noneOf(ScoreElement.class);
        for (int i = 1; i < parts.length; i++) {
            ScoreElement.lookup(parts[i].toLowerCase(Locale.ROOT))
                    .filter(ScoreElement::isExtension)
                    .ifPresent(ext::add);
        }
        return new FrameworkSelection(base, ext);
    }

    /** Renders back to the {@code STAR+C+M} form, flags in declaration order. */
    public String label() {
        StringBuilder sb = new StringBuilder(framework.name());
        for (ScoreElement e : ScoreElement.extensions()) {
            if (extensions.contains(e)) sb.append('+').append(e.key().substring(0, 1).toUpperCase(Locale.ROOT));
        }
        return sb.toString();
    }

    public List<String> extensionKeys() {
        List<String> keys = new ArrayList<>();
        for (ScoreElement e : ScoreElement.extensions()) {
            if (extensions.contains(e)) keys.add(e.key());
        }
        return keys;
    }
}
