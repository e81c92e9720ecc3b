package com.example.interview.service;

import com.example.interview.model.Dossier;
import com.example.interview.model.Framework;
import com.example.interview.model.ScoreAggregation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes per-question scores onto 0-100 and averages them per framework and per
 * extension element.
 * <p>
 * Base scores: {@code sum(scores_main) / (20 × element count) × 100}. Extension scores:
 * {@code score × 10}. Icebreaking, wrap-up and unknown question types, non-answers and
 * dossiers without scores are left out. The result does not depend on dossier order.
 */
@Service
public class ScoreAggregator {

    private static final Logger log = LoggerFactory.getLogger(ScoreAggregator.class);

    public ScoreAggregation aggregate(List<Dossier> dossiers) {
        Map<String, List<Double>> main = new TreeMap<>();
        Map<String, List<Double>> ext = new TreeMap<>();
        int scored = 0;

        for (Dossier d : dossiers) {
            Double normalized = normalizedScore(d);
            if (normalized == null) continue;
            main.computeIfAbsent(d.framework().framework().key(), k -> new ArrayList<>()).add(normalized);
            d.scoresExt().forEach((element, score) ->
                    ext.computeIfAbsent(element.key(), k -> new ArrayList<>()).add(score * 10.0));
            scored++;
        }

        ScoreAggregation aggregation = new ScoreAggregation(averages(main), averages(ext), scored);
        log.info("ScoreAggregator: {} of {} dossiers scored, main={}, ext={}",
                scored, dossiers.size(), aggregation.mainAvg(), aggregation.extAvg());
        return aggregation;
    }

    /**
     * Normalized 0-100 base score of one dossier, or {@code null} when it does not qualify.
     */
    public Double normalizedScore(Dossier d) {
        if (d == null || !d.questionType().isScored() || !d.intent().isEvaluated() || !d.hasScores()) {
            return null;
        }
        Framework framework = d.framework().framework();
        return round2(d.totalMain() * 100.0 / framework.maxMainScore());
    }

    private static Map<String, Double> averages(Map<String, List<Double>> groups) {
        Map<String, Double> out = new TreeMap<>();
        groups.forEach((key, values) -> {
            List<Double> sorted = new ArrayList<>(values);
            Collections.sort(sorted);
            double sum = 0;
            for (double v : sorted) sum += v;
            out.put(key, round2(sum / sorted.size()));
        });
        return out;
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
