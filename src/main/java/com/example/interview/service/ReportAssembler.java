package com.example.interview.service;

import com.example.interview.model.Dossier;
import com.example.interview.model.EvaluationStage;
import com.example.interview.model.EvidenceTheme;
import com.example.interview.model.HiringDecision;
import com.example.interview.model.Intent;
import com.example.interview.model.InterviewContext;
import com.example.interview.model.InterviewReport;
import com.example.interview.model.QuestionFeedback;
import com.example.interview.model.QuestionType;
import com.example.interview.model.ScoreAggregation;
import com.example.interview.model.Turn;
import com.example.interview.model.TurnRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the final report of a session and checks its referential integrity.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>strengths and weaknesses matrices from the coaching of every dossier</li>
 *   <li>score aggregation and hiring decision</li>
 *   <li>per-question feedback in transcript order</li>
 *   <li>validation: every evidence label must be a turn label of the session, every
 *       intent and question type must be recognized. Violations are collected into
 *       {@code validationErrors}; the report is always returned.</li>
 * </ul>
 */
@Service
public class ReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

    private final ScoreAggregator aggregator;
    private final HiringPolicy hiringPolicy;
    private final EvidenceMatrixBuilder matrixBuilder;

    public ReportAssembler(ScoreAggregator aggregator, HiringPolicy hiringPolicy,
                           EvidenceMatrixBuilder matrixBuilder) {
        this.aggregator = aggregator;
        this.hiringPolicy = hiringPolicy;
        this.matrixBuilder = matrixBuilder;
    }

    /**
     * Assembles the report.
     *
     * @param sessionId session id
     * @param context   session context
     * @param turns     full transcript of the session
     * @param dossiers  evaluations to report on
     * @param narrative overview paragraph
     * @return the report, with any validation errors attached
     */
    public InterviewReport buildReport(String sessionId, InterviewContext context, List<Turn> turns,
                                       List<Dossier> dossiers, String narrative) {
        ScoreAggregation aggregation = aggregator.aggregate(dossiers);
        HiringDecision decision = hiringPolicy.decide(aggregation);
        List<EvidenceTheme> strengths = matrixBuilder.strengths(dossiers);
        List<EvidenceTheme> weaknesses = matrixBuilder.weaknesses(dossiers);
        List<QuestionFeedback> feedback = questionFeedback(turns);

        Set<String> knownLabels = new LinkedHashSet<>();
        for (Turn t : turns) {
            knownLabels.add(t.label());
        }
        List<String> errors = validate(strengths, weaknesses, dossiers, knownLabels);

        InterviewReport report = new InterviewReport(sessionId, context.companyName(), context.jobTitle(),
                narrative, strengths, weaknesses, aggregation, decision, feedback, errors, Instant.now());

        if (errors.isEmpty()) {
            log.info("ReportAssembler: report for {} assembled ({} questions, {})",
                    sessionId, feedback.size(), decision.recommendation().value());
        } else {
            log.warn("ReportAssembler: report for {} assembled with {} validation errors: {}",
                    sessionId, errors.size(), errors);
        }
        return report;
    }

    /**
     * Checks matrix references and dossier enums against the session's turn labels.
     *
     * @return human-readable violations, empty when the report is consistent
     */
    public static List<String> validate(List<EvidenceTheme> strengths, List<EvidenceTheme> weaknesses,
                                        List<Dossier> dossiers, Set<String> knownLabels) {
        List<String> errors = new ArrayList<>();
        checkMatrix("strengths_matrix", strengths, knownLabels, errors);
        checkMatrix("weaknesses_matrix", weaknesses, knownLabels, errors);
        for (Dossier d : dossiers) {
            String label = d.questionLabel();
            if (label == null || !knownLabels.contains(label)) {
                errors.add("dossier label '" + label + "' does not match any turn");
            }
            if (d.intent() == Intent.UNKNOWN) {
                errors.add("dossier '" + label + "' has an unrecognized question_intent");
            }
            if (d.questionType() == QuestionType.UNKNOWN) {
                errors.add("dossier '" + label + "' has an unrecognized question type");
            }
        }
        return errors;
    }

    private static void checkMatrix(String name, List<EvidenceTheme> matrix, Set<String> knownLabels,
                                    List<String> errors) {
        for (EvidenceTheme theme : matrix) {
            for (String label : theme.evidence()) {
                if (!knownLabels.contains(label)) {
                    errors.add(name + " theme '" + theme.theme() + "' references unknown turn label '" + label + "'");
                }
            }
        }
    }

    private List<QuestionFeedback> questionFeedback(List<Turn> turns) {
        Map<String, String> questions = new HashMap<>();
        for (Turn t : turns) {
            if (t.role() == TurnRole.INTERVIEWER) questions.putIfAbsent(t.label(), t.text());
        }
        List<QuestionFeedback> out = new ArrayList<>();
        for (Turn t : turns) {
            if (t.role() != TurnRole.CANDIDATE || t.dossier() == null) continue;
            Dossier d = t.dossier();
            String feedback = !d.coaching().feedback().isEmpty()
                    ? d.coaching().feedback()
                    : d.explanation() != null ? d.explanation().overallTip() : "";
            out.add(new QuestionFeedback(
                    t.label(),
                    t.questionType(),
                    questions.getOrDefault(t.label(), ""),
                    t.text(),
                    d.intent(),
                    d.framework() != null ? d.framework().label() : null,
                    aggregator.normalizedScore(d),
                    feedback,
                    d.coaching().strengths(),
                    d.coaching().improvements(),
                    d.modelAnswer() != null ? d.modelAnswer().text() : null,
                    d.stageErrors().keySet().stream().map(EvaluationStage::name).toList()));
        }
        return out;
    }
}
