package com.example.interview.model;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Normalized 0-100 averages over all scored dossiers of a session.
 *
 * @param mainAvg       framework key (star, competency, case, systemdesign) to average
 * @param extAvg        extension key (challenge, learning, metrics) to average
 * @param scoredAnswers number of dossiers that entered the aggregation
 */
public record ScoreAggregation(Map<String, Double> mainAvg, Map<String, Double> extAvg, int scoredAnswers) {

    public ScoreAggregation {
        mainAvg = mainAvg != null ? Collections.unmodifiableMap(new TreeMap<>(mainAvg)) : Map.of();
        extAvg = extAvg != null ? Collections.unmodifiableMap(new TreeMap<>(extAvg)) : Map.of();
    }

    public static ScoreAggregation empty() {
        return new ScoreAggregation(Map.of(), Map.of(), 0);
    }

    public OptionalDouble main(Framework framework) {
        Double v = mainAvg.get(framework.key());
        return v != null ? OptionalDouble.of(v) : OptionalDouble.empty();
    }

    public OptionalDouble ext(ScoreElement element) {
        Double v = extAvg.get(element.key());
        return v != null ? OptionalDouble.of(v) : OptionalDouble.empty();
    }
}
