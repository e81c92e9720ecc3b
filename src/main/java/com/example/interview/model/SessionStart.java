package com.example.interview.model;

/**
 * Response of a session start: the new id and the first question.
 */
public record SessionStart(String sessionId, String label, String question, InterviewPlan plan) {}
