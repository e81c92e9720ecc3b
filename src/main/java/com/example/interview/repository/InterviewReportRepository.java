package com.example.interview.repository;

import com.example.interview.model.InterviewReport;
import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Archive of final interview reports (collection interview_reports), keyed by session id.
 */
public interface InterviewReportRepository extends MongoRepository<InterviewReport, String> {
}
