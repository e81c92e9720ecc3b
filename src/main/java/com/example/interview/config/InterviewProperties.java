package com.example.interview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties of the interview engine ({@code interview.*}).
 * Missing sections fall back to the defaults in each compact constructor.
 */
@ConfigurationProperties(prefix = "interview")
public record InterviewProperties(
        Llm llm,
        Hiring hiring,
        Followup followup,
        Plan plan
) {

    public InterviewProperties {
        if (llm == null) llm = new Llm(0, 0, 0);
        if (hiring == null) hiring = new Hiring(null, null, null, null, null, null, null);
        if (followup == null) followup = new Followup(0, 0, 0, 0, 0, 0, null, 0, 0);
        if (plan == null) plan = new Plan(0, 0, 0);
    }

    public static InterviewProperties defaults() {
        return new InterviewProperties(null, null, null, null);
    }

    /**
     * Model call settings.
     *
     * @param maxAttempts       attempts per call, including the first
     * @param initialBackoffMs  delay before the first retry
     * @param backoffMultiplier factor applied to the delay after each retry
     */
    public record Llm(int maxAttempts, long initialBackoffMs, double backoffMultiplier) {
        public Llm {
            if (maxAttempts <= 0) maxAttempts = 3;
            if (initialBackoffMs <= 0) initialBackoffMs = 800;
            if (backoffMultiplier < 1.0) backoffMultiplier = 2.0;
        }
    }

    /**
     * Hiring rule parameters.
     *
     * @param mainWeight weight of the mean framework average
     * @param extWeight  weight of the mean extension average
     * @param strongHire minimum weighted score for strong_hire
     * @param hire       minimum weighted score for hire
     * @param leanHire   minimum weighted score for lean_hire
     * @param metricsGate minimum metrics average for the top two tiers
     * @param starGate   minimum STAR average for the top two tiers, when STAR was used
     */
    public record Hiring(Double mainWeight, Double extWeight, Double strongHire, Double hire,
                         Double leanHire, Double metricsGate, Double starGate) {
        public Hiring {
            if (mainWeight == null) mainWeight = 0.7;
            if (extWeight == null) extWeight = 0.3;
            if (strongHire == null) strongHire = 80.0;
            if (hire == null) hire = 70.0;
            if (leanHire == null) leanHire = 60.0;
            if (metricsGate == null) metricsGate = 20.0;
            if (starGate == null) starGate = 60.0;
        }
    }

    /**
     * Follow-up rules.
     *
     * @param maxPerTurn           follow-ups produced by one answer
     * @param maxPending           capacity of the pending queue
     * @param maxPerMain           follow-ups asked for one main question in total
     * @param icebreakingMinChars  shorter icebreaking answers get a soft follow-up
     * @param selfIntroMinChars    shorter self introductions get a soft follow-up
     * @param motivationMinChars   shorter motivation answers get a soft follow-up
     * @param gapRatio             base elements below this share of their maximum are rubric gaps
     * @param sparseAnswerChars    answers shorter than this go straight to the template pool
     * @param maxLlmFollowupChars  longer generated follow-ups are rejected
     */
    public record Followup(int maxPerTurn, int maxPending, int maxPerMain,
                           int icebreakingMinChars, int selfIntroMinChars, int motivationMinChars,
                           Double gapRatio, int sparseAnswerChars, int maxLlmFollowupChars) {
        public Followup {
            if (maxPerTurn <= 0) maxPerTurn = 2;
            if (maxPending <= 0) maxPending = 3;
            if (maxPerMain <= 0) maxPerMain = 3;
            if (icebreakingMinChars <= 0) icebreakingMinChars = 25;
            if (selfIntroMinChars <= 0) selfIntroMinChars = 40;
            if (motivationMinChars <= 0) motivationMinChars = 40;
            if (gapRatio == null) gapRatio = 0.6;
            if (sparseAnswerChars <= 0) sparseAnswerChars = 30;
            if (maxLlmFollowupChars <= 0) maxLlmFollowupChars = 120;
        }
    }

    /**
     * Guards applied to generated plans and inputs.
     *
     * @param maxMains         main questions kept from a generated plan
     * @param maxTurns         transcript turns accepted per session
     * @param maxCharsPerField context fields are clipped to this length
     */
    public record Plan(int maxMains, int maxTurns, int maxCharsPerField) {
        public Plan {
            if (maxMains <= 0) maxMains = 20;
            if (maxTurns <= 0) maxTurns = 120;
            if (maxCharsPerField <= 0) maxCharsPerField = 12000;
        }
    }
}
