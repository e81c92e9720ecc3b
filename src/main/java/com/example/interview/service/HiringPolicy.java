package com.example.interview.service;

import com.example.interview.config.InterviewProperties;
import com.example.interview.model.Framework;
import com.example.interview.model.HiringDecision;
import com.example.interview.model.HiringRecommendation;
import com.example.interview.model.ScoreAggregation;
import com.example.interview.model.ScoreElement;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Hiring rule over a score aggregation.
 * <p>
 * {@code weighted = mainWeight × mean(mainAvg) + extWeight × mean(extAvg)}; an empty group
 * has mean 0. The two top tiers additionally need the metrics gate and, when STAR answers
 * were scored, the STAR gate. A missing metrics average fails the metrics gate.
 * Pure function of the configured parameters and the aggregation.
 */
@Service
public class HiringPolicy {

    private final InterviewProperties.Hiring params;

    public HiringPolicy(InterviewProperties properties) {
        this.params = properties.hiring();
    }

    public HiringDecision decide(ScoreAggregation aggregation) {
        double mainMean = mean(aggregation.mainAvg().values());
        double extMean = mean(aggregation.extAvg().values());
        double weighted = params.mainWeight() * mainMean + params.extWeight() * extMean;
        Double metrics = aggregation.extAvg().get(ScoreElement.METRICS.key());
        Double star = aggregation.mainAvg().get(Framework.STAR.key());
        return classify(weighted, metrics, star);
    }

    /**
     * Applies the tiers to an already weighted score.
     *
     * @param weighted   weighted 0-100 score
     * @param metricsAvg metrics average, {@code null} when no answer showed metrics
     * @param starAvg    STAR average, {@code null} when STAR was not used
     */
    public HiringDecision classify(double weighted, Double metricsAvg, Double starAvg) {
        List<String> reasons = new ArrayList<>();
        boolean metricsOk = metricsAvg != null && metricsAvg >= params.metricsGate();
        reasons.add(metricsAvg == null
                ? "metrics gate failed: no metrics evidence"
                : "metrics " + metricsAvg + (metricsOk ? " >= " : " < ") + params.metricsGate());
        boolean starOk = starAvg == null || starAvg >= params.starGate();
        if (starAvg != null) {
            reasons.add("star " + starAvg + (starOk ? " >= " : " < ") + params.starGate());
        }
        boolean gates = metricsOk && starOk;

        HiringRecommendation tier;
        if (weighted >= params.strongHire() && gates) {
            tier = HiringRecommendation.STRONG_HIRE;
        } else if (weighted >= params.hire() && gates) {
            tier = HiringRecommendation.HIRE;
        } else if (weighted >= params.leanHire()) {
            tier = HiringRecommendation.LEAN_HIRE;
        } else {
            tier = HiringRecommendation.NO_HIRE;
        }
        // tiers compare the unrounded score; only the reported value is rounded
        double reported = ScoreAggregator.round2(weighted);
        reasons.add("weighted " + reported + " -> " + tier.value());
        return new HiringDecision(tier, reported, gates, reasons);
    }

    private static double mean(Collection<Double> values) {
        if (values.isEmpty()) return 0.0;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.size();
    }
}
