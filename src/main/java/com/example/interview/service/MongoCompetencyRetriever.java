package com.example.interview.service;

import com.example.interview.model.CompetencyHint;
import com.example.interview.repository.CompetencyHintRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link CompetencyRetriever} over the competency_hints collection.
 * <p>
 * Results are cached per normalized query for the lifetime of the process; the same
 * query is repeated on every turn of a session. Failed lookups are not cached.
 */
@Service
public class MongoCompetencyRetriever implements CompetencyRetriever {

    private static final Logger log = LoggerFactory.getLogger(MongoCompetencyRetriever.class);

    private static final int MAX_HINTS = 5;

    private final CompetencyHintRepository repository;
    private final Map<String, List<String>> cache = new ConcurrentHashMap<>();

    public MongoCompetencyRetriever(CompetencyHintRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<String> lookup(String query) {
        if (query == null || query.isBlank()) return List.of();
        String key = query.trim().toLowerCase(Locale.ROOT);

        List<String> cached = cache.get(key);
        if (cached != null) return cached;

        try {
            List<String> hints = search(key);
            cache.put(key, hints);
            log.info("CompetencyRetriever: {} hints for '{}'", hints.size(), key);
            return hints;
        } catch (DataAccessException e) {
            log.warn("CompetencyRetriever: lookup failed for '{}' ({}), scoring without hints", key, e.getMessage());
            return List.of();
        }
    }

    int cacheSize() {
        return cache.size();
    }

    private List<String> search(String key) {
        Set<String> tokens = Arrays.stream(key.split("[^\\p{L}\\p{N}]+"))
                .filter(t -> t.length() >= 2)
                .collect(Collectors.toSet());

        Map<String, CompetencyHint> byId = new LinkedHashMap<>();
        for (CompetencyHint hint : repository.findByTitleContainingIgnoreCase(key)) {
            byId.putIfAbsent(hint.id(), hint);
        }
        if (!tokens.isEmpty()) {
            for (CompetencyHint hint : repository.findByKeywordsIn(tokens)) {
                byId.putIfAbsent(hint.id(), hint);
            }
        }

        List<CompetencyHint> ranked = new ArrayList<>(byId.values());
        ranked.sort(Comparator
                .comparingInt((CompetencyHint h) -> -overlap(h, tokens))
                .thenComparing(h -> h.title() != null ? h.title() : ""));

        return ranked.stream()
                .limit(MAX_HINTS)
                .map(h -> h.title() + ": " + (h.description() != null ? h.description() : ""))
                .toList();
    }

    private static int overlap(CompetencyHint hint, Set<String> tokens) {
        if (hint.keywords() == null) return 0;
        int n = 0;
        for (String kw : hint.keywords()) {
            if (kw != null && tokens.contains(kw.toLowerCase(Locale.ROOT))) n++;
        }
        return n;
    }
}
