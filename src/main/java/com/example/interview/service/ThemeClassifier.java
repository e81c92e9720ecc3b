package com.example.interview.service;

/**
 * Maps a coaching sentence to a short theme label for the evidence matrices.
 */
@FunctionalInterface
public interface ThemeClassifier {

    /**
     * @param sentence strength or improvement sentence
     * @return non-blank theme label
     */
    String themeOf(String sentence);
}
