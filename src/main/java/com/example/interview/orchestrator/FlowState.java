package com.example.interview.orchestrator;

import com.example.interview.model.InterviewPhase;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Cursor of the interview flow. Written only by {@link InterviewFlowController}; each session
 * has its own instance.
 */
public final class FlowState {

    private InterviewPhase phase = InterviewPhase.INTRO;
    private int phaseIndex;
    private int questionIndex;
    private int followupIndex;
    private final Deque<String> pendingFollowups = new ArrayDeque<>();
    private String lastMainQuestionId;
    private String mainLabel;
    private String lastQuestionLabel;
    private String lastQuestionText;
    private boolean done;

    FlowState() {
    }

    public InterviewPhase getPhase() {
        return phase;
    }

    public int getPhaseIndex() {
        return phaseIndex;
    }

    public int getQuestionIndex() {
        return questionIndex;
    }

    public int getFollowupIndex() {
        return followupIndex;
    }

    public List<String> getPendingFollowups() {
        return List.copyOf(pendingFollowups);
    }

    public String getLastMainQuestionId() {
        return lastMainQuestionId;
    }

    public String getMainLabel() {
        return mainLabel;
    }

    public String getLastQuestionLabel() {
        return lastQuestionLabel;
    }

    public String getLastQuestionText() {
        return lastQuestionText;
    }

    public boolean isDone() {
        return done;
    }

    /** A main question has been delivered. */
    boolean isStarted() {
        return lastMainQuestionId != null;
    }

    Deque<String> pending() {
        return pendingFollowups;
    }

    void moveTo(int phaseIndex, int questionIndex) {
        this.phaseIndex = phaseIndex;
        this.questionIndex = questionIndex;
    }

    void setPhase(InterviewPhase phase) {
        this.phase = phase;
    }

    void startMain(String itemId, String label, String question) {
        this.lastMainQuestionId = itemId;
        this.mainLabel = label;
        this.followupIndex = 0;
        this.lastQuestionLabel = label;
        this.lastQuestionText = question;
    }

    String startFollowup(String question) {
        this.followupIndex++;
        this.lastQuestionLabel = mainLabel + "-" + followupIndex;
        this.lastQuestionText = question;
        return lastQuestionLabel;
    }

    void finish() {
        this.phase = InterviewPhase.FINISHED;
        this.pendingFollowups.clear();
        this.done = true;
    }
}
