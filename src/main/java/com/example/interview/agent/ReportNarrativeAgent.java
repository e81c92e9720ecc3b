package com.example.interview.agent;

import com.example.interview.model.EvidenceTheme;
import com.example.interview.model.InterviewReport;
import com.example.interview.model.StageResult;
import com.example.interview.service.JsonNodes;
import com.example.interview.service.LlmClient;
import com.example.interview.service.PromptChainExecutor;
import com.example.interview.service.PromptStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the narrative overview of a final report with the report model.
 * Falls back to a deterministic summary built from the report itself.
 */
@Service
public class ReportNarrativeAgent {

    private static final Logger log = LoggerFactory.getLogger(ReportNarrativeAgent.class);

    private static final int TOP_THEMES = 3;

    static final PromptStage OVERVIEW = new PromptStage("report_overview", """
            You are a senior interviewer writing the summary of an interview for the hiring committee.
            Role: {role} at {company}.

            [Hiring rule outcome]
            {decision}

            [Normalized averages, 0-100]
            Frameworks: {main_avg}
            Extensions: {ext_avg}

            [Strength themes (turn labels)]
            {strengths}

            [Weakness themes (turn labels)]
            {weaknesses}

            Write 4-6 sentences: overall impression, the clearest strengths with turn labels,
            the main gaps, and what to verify in the next round. Do not change the recommendation.

            Output schema:
            {"overview": ""}
            """, 0.3, 700);

    private final PromptChainExecutor executor;
    private final LlmClient llm;

    public ReportNarrativeAgent(PromptChainExecutor executor,
                                @Qualifier("reportLlmClient") LlmClient llm) {
        this.executor = executor;
        this.llm = llm;
    }

    public String narrate(InterviewReport report) {
        StageResult r = executor.runStage(OVERVIEW, Map.of(
                "role", report.jobTitle(),
                "company", report.companyName(),
                "decision", String.join("; ", report.hiringDecision().reasons()),
                "main_avg", report.scoreAggregation().mainAvg().toString(),
                "ext_avg", report.scoreAggregation().extAvg().toString(),
                "strengths", themes(report.strengthsMatrix()),
                "weaknesses", themes(report.weaknessesMatrix())), llm);
        if (!r.isError()) {
            String overview = JsonNodes.text(r.payload(), "overview");
            if (!overview.isEmpty()) return overview;
        }
        log.warn("ReportNarrativeAgent: model overview unavailable ({}), using summary fallback",
                r.isError() ? r.error() : "empty overview");
        return fallbackOverview(report);
    }

    static String fallbackOverview(InterviewReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Interview for ").append(report.jobTitle()).append(" at ").append(report.companyName())
                .append(": ").append(report.scoreAggregation().scoredAnswers()).append(" scored answers, weighted score ")
                .append(report.hiringDecision().weighted()).append(", recommendation ")
                .append(report.hiringDecision().recommendation().value()).append('.');
        if (!report.strengthsMatrix().isEmpty()) {
            sb.append(" Strengths: ").append(themeNames(report.strengthsMatrix())).append('.');
        }
        if (!report.weaknessesMatrix().isEmpty()) {
            sb.append(" To improve: ").append(themeNames(report.weaknessesMatrix())).append('.');
        }
        return sb.toString();
    }

    private static String themes(List<EvidenceTheme> matrix) {
        if (matrix.isEmpty()) return "(none)";
        return matrix.stream()
                .limit(TOP_THEMES * 2)
                .map(t -> "- " + t.theme() + " " + t.evidence())
                .collect(Collectors.joining("\n"));
    }

    private static String themeNames(List<EvidenceTheme> matrix) {
        return matrix.stream().limit(TOP_THEMES).map(EvidenceTheme::theme).collect(Collectors.joining(", "));
    }
}
