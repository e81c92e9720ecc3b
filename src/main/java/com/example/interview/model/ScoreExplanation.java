package com.example.interview.model;

import java.util.List;

/**
 * Per-element score explanations for one answer.
 */
public record ScoreExplanation(List<ElementCalibration> calibration, String overallTip) {

    public ScoreExplanation {
        calibration = calibration != null ? List.copyOf(calibration) : List.of();
        if (overallTip == null) overallTip = "";
    }
}
