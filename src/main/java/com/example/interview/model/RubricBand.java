package com.example.interview.model;

/**
 * One discrete score band of an item rubric.
 *
 * @param score      band score (e.g. 1-5)
 * @param descriptor what an answer in this band looks like
 */
public record RubricBand(int score, String descriptor) {}
