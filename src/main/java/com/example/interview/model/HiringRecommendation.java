package com.example.interview.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HiringRecommendation {
    STRONG_HIRE,
    HIRE,
    LEAN_HIRE,
    NO_HIRE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
