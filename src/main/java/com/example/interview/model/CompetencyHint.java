package com.example.interview.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

/**
 * Competency description (NCS unit or company value) used to ground scoring.
 * Read from the {@code competency_hints} collection.
 */
@Document(collection = "competency_hints")
public record CompetencyHint(
        @Id String id,
        String title,
        String description,
        List<String> keywords
) {}
