package com.example.interview.model;

import java.util.List;

/**
 * Explanation of one element score.
 *
 * @param element      score key
 * @param given        score assigned
 * @param max          element maximum
 * @param whyNotMax    what kept the score below the maximum
 * @param howToImprove 1-3 concrete actions
 */
public record ElementCalibration(String element, int given, int max, String whyNotMax, List<String> howToImprove) {

    public ElementCalibration {
        if (whyNotMax == null) whyNotMax = "";
        howToImprove = howToImprove != null ? List.copyOf(howToImprove) : List.of();
    }

    public int gap() {
        return Math.max(0, max - given);
    }
}
