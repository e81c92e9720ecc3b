package com.example.interview.orchestrator;

import com.example.interview.model.Dossier;
import com.example.interview.model.InterviewContext;
import com.example.interview.model.InterviewReport;
import com.example.interview.model.Turn;
import com.example.interview.model.TurnRole;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One interview: context, flow and transcript. Every operation on a session runs under
 * its {@link #lock()}; turns are appended and never changed afterwards.
 */
public class InterviewSession {

    private final String id;
    private final InterviewContext context;
    private final InterviewFlowController flow;
    private final List<Turn> turns = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Instant createdAt = Instant.now();
    private volatile InterviewReport report;

    public InterviewSession(String id, InterviewContext context, InterviewFlowController flow) {
        this.id = id;
        this.context = context;
        this.flow = flow;
    }

    public String id() {
        return id;
    }

    public InterviewContext context() {
        return context;
    }

    public InterviewFlowController flow() {
        return flow;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<Turn> turns() {
        return List.copyOf(turns);
    }

    void append(Turn turn) {
        turns.add(turn);
    }

    int turnCount() {
        return turns.size();
    }

    /** Dossiers of candidate turns, in transcript order. */
    public List<Dossier> dossiers() {
        return turns.stream()
                .filter(t -> t.role() == TurnRole.CANDIDATE && t.dossier() != null)
                .map(Turn::dossier)
                .toList();
    }

    public InterviewReport report() {
        return report;
    }

    void cacheReport(InterviewReport report) {
        this.report = report;
    }
}
