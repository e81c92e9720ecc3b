package com.example.interview.orchestrator;

import com.example.interview.config.InterviewProperties;
import com.example.interview.model.Intent;
import com.example.interview.model.InterviewPlan;
import com.example.interview.model.NextQuestion;
import com.example.interview.model.PlanItem;
import com.example.interview.model.QuestionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * State machine of one interview: {@code INTRO → CORE → WRAPUP → FINISHED}.
 * <p>
 * The cursor {@code (phaseIndex, questionIndex, followupIndex)} only moves in
 * {@link #nextQuestion()}. Pending follow-ups are served before the next main question.
 * Phase and question exhaustion are always checked against the plan's item counts.
 * Not thread-safe: callers hold the session lock.
 */
public class InterviewFlowController {

    private static final Logger log = LoggerFactory.getLogger(InterviewFlowController.class);

    private final InterviewPlan plan;
    private final int maxPending;
    private final int maxPerMain;
    private final FlowState state = new FlowState();

    public InterviewFlowController(InterviewPlan plan, InterviewProperties.Followup settings) {
        this.plan = plan;
        this.maxPending = settings.maxPending();
        this.maxPerMain = settings.maxPerMain();
        if (plan.phaseCount() > 0) {
            state.setPhase(plan.phases().get(0).state());
        }
    }

    public InterviewFlowController(InterviewPlan plan) {
        this(plan, InterviewProperties.defaults().followup());
    }

    public FlowState state() {
        return state;
    }

    public InterviewPlan plan() {
        return plan;
    }

    public boolean isFinished() {
        return state.isDone();
    }

    /**
     * Returns the next pending follow-up, or the next main question, or {@code done}.
     */
    public NextQuestion nextQuestion() {
        if (state.isDone()) {
            return NextQuestion.finished();
        }

        // ── Pending follow-up first ──────────────────────────────────────────
        if (!state.pending().isEmpty()) {
            String followup = state.pending().poll();
            String label = state.startFollowup(followup);
            log.debug("FlowController: follow-up {} served ({} still pending)", label, state.pending().size());
            return NextQuestion.followup(label, followup, currentItem().type());
        }

        // ── Advance the main cursor ──────────────────────────────────────────
        int[] next = nextMainPosition();
        int phaseIndex = next[0];
        int questionIndex = next[1];
        if (phaseIndex >= plan.phaseCount()) {
            state.finish();
            log.info("FlowController: plan exhausted, interview finished");
            return NextQuestion.finished();
        }

        state.moveTo(phaseIndex, questionIndex);
        state.setPhase(plan.phases().get(phaseIndex).state());
        PlanItem item = plan.item(phaseIndex, questionIndex);
        String label = String.valueOf(plan.ordinal(phaseIndex, questionIndex));
        state.startMain(item.id() != null ? item.id() : label, label, item.question());
        log.debug("FlowController: main question {} ({}, phase {})", label, item.type().tag(), state.getPhase());
        return NextQuestion.main(label, item.question(), item.type());
    }

    /**
     * Applies a classified reply. Non-answers get a recovery prompt; answers may queue
     * follow-ups. The main cursor never moves here.
     *
     * @param intent    classified intent of the reply
     * @param followups follow-ups decided for the reply
     */
    public AnswerTransition onAnswer(Intent intent, List<String> followups) {
        if (state.isDone()) {
            return AnswerTransition.finished();
        }
        if (!intent.isEvaluated()) {
            String recovery = RecoveryPrompts.forIntent(intent, state.getLastQuestionText());
            log.info("FlowController: {} on {}, cursor kept", intent, state.getLastQuestionLabel());
            return new AnswerTransition(recovery, List.of(), false);
        }

        List<String> accepted = new ArrayList<>();
        if (followups != null) {
            for (String f : followups) {
                int askedOrQueued = state.getFollowupIndex() + state.pending().size();
                if (state.pending().size() >= maxPending || askedOrQueued >= maxPerMain) break;
                if (f == null || f.isBlank()) continue;
                state.pending().add(f.strip());
                accepted.add(f.strip());
            }
            if (accepted.size() < followups.size()) {
                log.debug("FlowController: {} of {} follow-ups dropped by queue limits",
                        followups.size() - accepted.size(), followups.size());
            }
        }
        return new AnswerTransition(null, accepted, false);
    }

    /** Text the next {@link #nextQuestion()} call would return, without moving the cursor. */
    public Optional<String> peekNextQuestion() {
        if (state.isDone()) return Optional.empty();
        if (!state.pending().isEmpty()) return Optional.of(state.pending().peek());
        int[] next = nextMainPosition();
        return next[0] < plan.phaseCount()
                ? Optional.of(plan.item(next[0], next[1]).question())
                : Optional.empty();
    }

    /** Position of the next main question; phase index equals the phase count when exhausted. */
    private int[] nextMainPosition() {
        int phaseIndex = state.getPhaseIndex();
        int questionIndex = state.isStarted() ? state.getQuestionIndex() + 1 : state.getQuestionIndex();
        while (phaseIndex < plan.phaseCount() && questionIndex >= plan.itemCount(phaseIndex)) {
            phaseIndex++;
            questionIndex = 0;
        }
        return new int[]{phaseIndex, questionIndex};
    }

    /** Whether the next question is a new main question rather than a pending follow-up. */
    public boolean nextIsMain() {
        return state.pending().isEmpty();
    }

    /** Plan item of the current main question. */
    public PlanItem currentItem() {
        return plan.item(state.getPhaseIndex(), state.getQuestionIndex());
    }

    /** Type of the question last asked, {@link QuestionType#UNKNOWN} before the first one. */
    public QuestionType currentType() {
        return state.isStarted() ? currentItem().type() : QuestionType.UNKNOWN;
    }

    /** Forces the terminal state, e.g. when the candidate ends the interview early. */
    public void finish() {
        if (!state.isDone()) {
            state.finish();
            log.info("FlowController: interview finished at {}", state.getLastQuestionLabel());
        }
    }
}
