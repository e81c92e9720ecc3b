package com.example.interview.repository;

import com.example.interview.model.CompetencyHint;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Competency hints (collection competency_hints).
 */
public interface CompetencyHintRepository extends MongoRepository<CompetencyHint, String> {

    List<CompetencyHint> findByKeywordsIn(Collection<String> keywords);

    List<CompetencyHint> findByTitleContainingIgnoreCase(String title);
}
