package com.example.interview.service;

import com.example.interview.config.InterviewProperties;
import com.example.interview.model.Coaching;
import com.example.interview.model.Dossier;
import com.example.interview.model.EvaluationStage;
import com.example.interview.model.EvidenceTheme;
import com.example.interview.model.Framework;
import com.example.interview.model.FrameworkSelection;
import com.example.interview.model.Intent;
import com.example.interview.model.InterviewContext;
import com.example.interview.model.InterviewReport;
import com.example.interview.model.ModelAnswer;
import com.example.interview.model.QuestionFeedback;
import com.example.interview.model.QuestionType;
import com.example.interview.model.ScoreElement;
import com.example.interview.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReportAssemblerTest {

    private static final InterviewContext CONTEXT =
            new InterviewContext("Acme", "Backend Engineer", null, null, null, null, null, null);

    private ReportAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ReportAssembler(new ScoreAggregator(),
                new HiringPolicy(InterviewProperties.defaults()),
                new EvidenceMatrixBuilder(new KeywordThemeClassifier()));
    }

    private static Dossier starAnswer(String label) {
        return new Dossier(label, QuestionType.STAR, Intent.ANSWER, FrameworkSelection.parse("STAR+M", Framework.STAR),
                Map.of("situation", "legacy billing"),
                Map.of(ScoreElement.SITUATION, 16, ScoreElement.TASK, 16, ScoreElement.ACTION, 18, ScoreElement.RESULT, 14),
                Map.of(ScoreElement.METRICS, 8),
                "solid episode",
                null,
                new Coaching(List.of("\"cut latency by 40%\" shows a measured result"),
                        List.of("Be more specific about your own role"), "Good structure."),
                new ModelAnswer("At my last job ...", "STAR", "episode question"),
                null,
                Map.of(EvaluationStage.BIAS_FILTER, "unparseable model output after correction"));
    }

    @Test
    @DisplayName("a consistent session produces a report without validation errors")
    void consistentReport() {
        Dossier dossier = starAnswer("1");
        List<Turn> turns = List.of(
                Turn.interviewer("1", "Tell me about a hard project.", QuestionType.STAR),
                Turn.candidate("1", "We rebuilt billing and cut latency by 40%.", QuestionType.STAR, dossier));

        InterviewReport report = assembler.buildReport("s-1", CONTEXT, turns, List.of(dossier), "Overview text");

        assertThat(report.isValid()).isTrue();
        assertThat(report.sessionId()).isEqualTo("s-1");
        assertThat(report.companyName()).isEqualTo("Acme");
        assertThat(report.overview()).isEqualTo("Overview text");
        assertThat(report.scoreAggregation().mainAvg()).containsEntry("star", 80.0);
        assertThat(report.strengthsMatrix()).extracting(EvidenceTheme::theme).containsExactly("Quantified results");
        assertThat(report.weaknessesMatrix()).extracting(EvidenceTheme::theme).containsExactly("Specificity");

        QuestionFeedback feedback = report.questionFeedback().get(0);
        assertThat(feedback.question()).isEqualTo("Tell me about a hard project.");
        assertThat(feedback.answer()).contains("billing");
        assertThat(feedback.framework()).isEqualTo("STAR+M");
        assertThat(feedback.normalizedScore()).isEqualTo(80.0);
        assertThat(feedback.feedback()).isEqualTo("Good structure.");
        assertThat(feedback.modelAnswer()).startsWith("At my last job");
        assertThat(feedback.failedStages()).containsExactly("BIAS_FILTER");
    }

    @Test
    @DisplayName("an evidence label that is not a turn label is reported, and the report is still returned")
    void unknownEvidenceLabel() {
        Dossier dossier = starAnswer("7");
        List<Turn> turns = List.of(
                Turn.interviewer("1", "Tell me about a hard project.", QuestionType.STAR),
                Turn.candidate("1", "answer", QuestionType.STAR, dossier.withQuestionLabel("1")));

        InterviewReport report = assembler.buildReport("s-2", CONTEXT, turns, List.of(dossier), null);

        assertThat(report).isNotNull();
        assertThat(report.isValid()).isFalse();
        assertThat(report.validationErrors())
                .anyMatch(e -> e.contains("references unknown turn label '7'"))
                .anyMatch(e -> e.contains("dossier label '7'"));
        assertThat(report.hiringDecision()).isNotNull();
    }

    @Test
    void unrecognizedEnumsAreReported() {
        Dossier unknown = new Dossier("1", QuestionType.UNKNOWN, Intent.UNKNOWN, null, null, null, null,
                null, null, null, null, null, null);

        List<String> errors = ReportAssembler.validate(List.of(), List.of(), List.of(unknown), Set.of("1"));

        assertThat(errors).hasSize(2)
                .anyMatch(e -> e.contains("question_intent"))
                .anyMatch(e -> e.contains("question type"));
    }

    @Test
    void matrixReferencesAreChecked() {
        List<EvidenceTheme> strengths = List.of(new EvidenceTheme("Ownership", List.of("1", "2-1"), List.of()));

        assertThat(ReportAssembler.validate(strengths, List.of(), List.of(), Set.of("1", "2-1"))).isEmpty();
        assertThat(ReportAssembler.validate(strengths, List.of(), List.of(), Set.of("1")))
                .containsExactly("strengths_matrix theme 'Ownership' references unknown turn label '2-1'");
    }
}
