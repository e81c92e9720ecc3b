package com.example.interview.service;

import java.util.List;

/**
 * Looks up competency and company-context hints that ground answer scoring.
 */
public interface CompetencyRetriever {

    /**
     * @param query free-text query, usually the job title or a competency name
     * @return hint texts, most relevant first; empty when nothing matches
     */
    List<String> lookup(String query);
}
