package com.example.interview.model;

/**
 * Body of {@code POST /api/interview/{id}/answer}.
 */
public record AnswerRequest(String question, String answer) {}
