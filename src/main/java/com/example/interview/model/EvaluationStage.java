package com.example.interview.model;

/**
 * Stages of the answer evaluation chain, in execution order.
 */
public enum EvaluationStage {
    INTENT,
    FRAMEWORK,
    EXTRACTION,
    SCORING,
    SCORE_EXPLANATION,
    COACHING,
    MODEL_ANSWER,
    BIAS_FILTER
}
