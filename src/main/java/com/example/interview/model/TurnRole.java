package com.example.interview.model;

public enum TurnRole {
    INTERVIEWER,
    CANDIDATE
}
