package com.example.interview.service;

import com.example.interview.model.Dossier;
import com.example.interview.model.EvidenceTheme;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Groups coaching sentences by theme and maps each theme to the turn labels that produced it.
 */
@Service
public class EvidenceMatrixBuilder {

    private static final int MAX_EXAMPLES = 3;

    private final ThemeClassifier classifier;

    public EvidenceMatrixBuilder(ThemeClassifier classifier) {
        this.classifier = classifier;
    }

    public List<EvidenceTheme> strengths(List<Dossier> dossiers) {
        return build(dossiers, d -> d.coaching().strengths());
    }

    public List<EvidenceTheme> weaknesses(List<Dossier> dossiers) {
        return build(dossiers, d -> d.coaching().improvements());
    }

    /**
     * Themes are ordered by number of supporting turns, then by name; labels keep turn order.
     */
    List<EvidenceTheme> build(List<Dossier> dossiers, Function<Dossier, List<String>> sentences) {
        Map<String, Set<String>> labels = new LinkedHashMap<>();
        Map<String, List<String>> examples = new LinkedHashMap<>();
        for (Dossier d : dossiers) {
            if (d.questionLabel() == null) continue;
            for (String sentence : sentences.apply(d)) {
                String theme = classifier.themeOf(sentence);
                labels.computeIfAbsent(theme, k -> new LinkedHashSet<>()).add(d.questionLabel());
                List<String> ex = examples.computeIfAbsent(theme, k -> new ArrayList<>());
                if (ex.size() < MAX_EXAMPLES) ex.add(sentence);
            }
        }
        return labels.entrySet().stream()
                .sorted(Comparator
                        .comparingInt((Map.Entry<String, Set<String>> e) -> -e.getValue().size())
                        .thenComparing(Map.Entry::getKey))
                .map(e -> new EvidenceTheme(e.getKey(), List.copyOf(e.getValue()), examples.get(e.getKey())))
                .toList();
    }
}
