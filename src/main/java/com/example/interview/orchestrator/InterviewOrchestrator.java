package com.example.interview.orchestrator;

import com.example.interview.agent.AnswerEvaluator;
import com.example.interview.agent.FollowupAgent;
import com.example.interview.agent.PlanDesignerAgent;
import com.example.interview.agent.ReportNarrativeAgent;
import com.example.interview.config.InterviewProperties;
import com.example.interview.model.AnswerOutcome;
import com.example.interview.model.Dossier;
import com.example.interview.model.EvaluationContext;
import com.example.interview.model.FollowupDecision;
import com.example.interview.model.InterviewContext;
import com.example.interview.model.InterviewPlan;
import com.example.interview.model.InterviewReport;
import com.example.interview.model.NextQuestion;
import com.example.interview.model.PlanItem;
import com.example.interview.model.PlanPhase;
import com.example.interview.model.QuestionType;
import com.example.interview.model.SessionStart;
import com.example.interview.model.Turn;
import com.example.interview.repository.InterviewReportRepository;
import com.example.interview.service.CompetencyRetriever;
import com.example.interview.service.ReportAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Entry point of the engine. Owns the live sessions and runs every turn:
 * <pre>
 * answer → evaluator → follow-up decision → flow update
 * finish → aggregation → report assembly → narrative → archive
 * </pre>
 * Operations on one session are serialized by the session lock; different sessions run
 * concurrently and share nothing but the competency lookup cache. A finished session is
 * dropped from the live map; only its report stays, in a bounded recent-report cache and
 * in the archive.
 */
@Service
public class InterviewOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(InterviewOrchestrator.class);

    private final PlanDesignerAgent planDesigner;
    private final AnswerEvaluator evaluator;
    private final FollowupAgent followupAgent;
    private final ReportNarrativeAgent narrativeAgent;
    private final ReportAssembler reportAssembler;
    private final CompetencyRetriever competencyRetriever;
    private final InterviewReportRepository reportRepository;
    private final InterviewProperties properties;

    private static final int RECENT_REPORTS = 256;

    private final Map<String, InterviewSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, InterviewReport> recentReports = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, InterviewReport> eldest) {
                    return size() > RECENT_REPORTS;
                }
            });

    public InterviewOrchestrator(PlanDesignerAgent planDesigner,
                                 AnswerEvaluator evaluator,
                                 FollowupAgent followupAgent,
                                 ReportNarrativeAgent narrativeAgent,
                                 ReportAssembler reportAssembler,
                                 CompetencyRetriever competencyRetriever,
                                 InterviewReportRepository reportRepository,
                                 InterviewProperties properties) {
        this.planDesigner = planDesigner;
        this.evaluator = evaluator;
        this.followupAgent = followupAgent;
        this.narrativeAgent = narrativeAgent;
        this.reportAssembler = reportAssembler;
        this.competencyRetriever = competencyRetriever;
        this.reportRepository = reportRepository;
        this.properties = properties;
    }

    /**
     * Starts a session and delivers its first question.
     *
     * @param context interview context
     * @param plan    caller-supplied plan, or {@code null} to design one
     * @throws com.example.interview.service.LlmUnavailableException when no plan can be designed
     * @throws IllegalArgumentException when the plan has no questions
     */
    public SessionStart startSession(InterviewContext context, InterviewPlan plan) {
        InterviewContext clipped = context.clipped(properties.plan().maxCharsPerField());
        long start = System.currentTimeMillis();

        InterviewPlan effective = plan != null && plan.totalItems() > 0
                ? capPlan(plan)
                : planDesigner.design(clipped, competencyRetriever.lookup(clipped.competencyQuery()));
        if (effective.totalItems() == 0) {
            throw new IllegalArgumentException("Interview plan has no questions");
        }

        String sessionId = UUID.randomUUID().toString();
        InterviewSession session = new InterviewSession(sessionId, clipped,
                new InterviewFlowController(effective, properties.followup()));
        NextQuestion first = session.flow().nextQuestion();
        session.append(Turn.interviewer(first.label(), first.question(), first.type()));
        sessions.put(sessionId, session);

        log.info("Session {} started for {} at {} ({} questions, {}ms)", sessionId, clipped.jobTitle(),
                clipped.companyName(), effective.totalItems(), System.currentTimeMillis() - start);
        return new SessionStart(sessionId, first.label(), first.question(), effective);
    }

    /**
     * Evaluates an answer to the question last asked.
     *
     * @param sessionId session id
     * @param question  question text as shown to the candidate; the last asked question when blank
     * @param answer    candidate reply
     * @return analysis, follow-ups and hints; {@code done} when the session is finished
     */
    public AnswerOutcome submitAnswer(String sessionId, String question, String answer) {
        InterviewSession session = sessions.get(sessionId);
        if (session == null) {
            requireFinished(sessionId);
            log.info("Session {}: answer after finish ignored", sessionId);
            return AnswerOutcome.finished();
        }
        return withLock(session, () -> {
            InterviewFlowController flow = session.flow();
            if (flow.isFinished()) {
                log.info("Session {}: answer after finish ignored", sessionId);
                return AnswerOutcome.finished();
            }
            if (session.turnCount() >= properties.plan().maxTurns()) {
                log.warn("Session {}: turn limit {} reached, finishing", sessionId, properties.plan().maxTurns());
                flow.finish();
                return AnswerOutcome.finished();
            }

            FlowState state = flow.state();
            String label = state.getLastQuestionLabel();
            String askedQuestion = question != null && !question.isBlank() ? question : state.getLastQuestionText();
            PlanItem item = flow.currentItem();
            QuestionType type = item.type();
            EvaluationContext context = new EvaluationContext(label, type, item.expectedPoints(), item.rubric(),
                    session.context(), type.isScored() ? competencyRetriever.lookup(session.context().competencyQuery()) : List.of());

            // ── Evaluation ───────────────────────────────────────────────────
            // icebreaking and wrap-up replies only need their intent
            Dossier dossier = type.isScored()
                    ? evaluator.evaluate(askedQuestion, answer, context)
                    : evaluator.classifyOnly(askedQuestion, answer, context);

            // ── Follow-up decision ───────────────────────────────────────────
            FollowupDecision decision = dossier.intent().isEvaluated()
                    ? followupAgent.decide(type, askedQuestion, answer, dossier, context)
                    : FollowupDecision.none("not an answer");

            // ── Flow update ──────────────────────────────────────────────────
            AnswerTransition transition = flow.onAnswer(dossier.intent(), decision.followups());
            session.append(Turn.candidate(label, answer != null ? answer : "", type, dossier));
            if (transition.recoveryPrompt() != null) {
                session.append(Turn.interviewer(label, transition.recoveryPrompt(), type));
            }

            String hint = flow.peekNextQuestion().orElse(null);
            String transitionPhrase = transition.recoveryPrompt() == null && flow.nextIsMain() && hint != null
                    ? followupAgent.transitionPhrase(session.turnCount())
                    : null;

            log.info("Session {}: answer to {} processed (intent {}, {} follow-ups queued{})", sessionId, label,
                    dossier.intent(), transition.enqueued().size(), decision.templateFallback() ? ", template fallback" : "");
            return new AnswerOutcome(label, dossier, transition.recoveryPrompt(), transition.enqueued(),
                    decision.templateFallback(), transitionPhrase, hint, false);
        });
    }

    /**
     * Delivers the next follow-up or main question, or {@code done}.
     */
    public NextQuestion nextQuestion(String sessionId) {
        InterviewSession session = sessions.get(sessionId);
        if (session == null) {
            requireFinished(sessionId);
            return NextQuestion.finished();
        }
        return withLock(session, () -> {
            NextQuestion next = session.flow().nextQuestion();
            if (!next.done()) {
                session.append(Turn.interviewer(next.label(), next.question(), next.type()));
            }
            return next;
        });
    }

    /**
     * Finishes the session, releases its live state and returns its report. Repeated calls
     * return the cached or archived report.
     */
    public InterviewReport finishSession(String sessionId) {
        InterviewSession session = sessions.get(sessionId);
        if (session == null) {
            return requireFinished(sessionId);
        }
        return withLock(session, () -> {
            if (session.report() != null) {
                return session.report();
            }
            session.flow().finish();
            long start = System.currentTimeMillis();

            List<Turn> turns = session.turns();
            InterviewReport draft = reportAssembler.buildReport(sessionId, session.context(), turns,
                    session.dossiers(), null);
            InterviewReport report = draft.withOverview(narrativeAgent.narrate(draft));
            session.cacheReport(report);
            archive(report);
            recentReports.put(sessionId, report);
            sessions.remove(sessionId);

            log.info("Session {} finished: {} turns, {} ({}ms)", sessionId, turns.size(),
                    report.hiringDecision().recommendation().value(), System.currentTimeMillis() - start);
            return report;
        });
    }

    /** Report of a finished session, from memory or the archive. */
    public Optional<InterviewReport> findReport(String sessionId) {
        InterviewReport recent = recentReports.get(sessionId);
        if (recent != null) {
            return Optional.of(recent);
        }
        try {
            return reportRepository.findById(sessionId);
        } catch (DataAccessException e) {
            log.warn("Report archive unavailable ({})", e.getMessage());
            return Optional.empty();
        }
    }

    /** Live state of an unfinished session. */
    public InterviewSession session(String sessionId) {
        InterviewSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // Internal helpers
    // ═══════════════════════════════════════════════════════════════════════════

    private InterviewPlan capPlan(InterviewPlan plan) {
        int max = properties.plan().maxMains();
        if (plan.totalItems() <= max) return plan;
        List<PlanPhase> capped = new ArrayList<>();
        int remaining = max;
        for (PlanPhase phase : plan.phases()) {
            List<PlanItem> items = phase.items().subList(0, Math.min(remaining, phase.items().size()));
            remaining -= items.size();
            if (!items.isEmpty()) capped.add(new PlanPhase(phase.name(), items));
        }
        log.info("Plan capped from {} to {} questions", plan.totalItems(), max);
        return new InterviewPlan(capped);
    }

    private InterviewReport requireFinished(String sessionId) {
        return findReport(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private void archive(InterviewReport report) {
        try {
            reportRepository.save(report);
        } catch (DataAccessException e) {
            log.warn("Session {}: report not archived ({})", report.sessionId(), e.getMessage());
        }
    }

    private static <T> T withLock(InterviewSession session, Supplier<T> action) {
        session.lock().lock();
        try {
            return action.get();
        } finally {
            session.lock().unlock();
        }
    }
}
