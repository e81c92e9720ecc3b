package com.example.interview.service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-request model usage counters backed by an {@link InheritableThreadLocal}.
 *
 * <p>Usage pattern:
 * <pre>
 *   TokenUsageAccumulator usage = TokenUsageAccumulator.start();   // controller
 *   try {
 *       orchestrator.submitAnswer(...);
 *   } finally {
 *       TokenUsageAccumulator.clear();
 *   }
 * </pre>
 * Calls made outside a request (tests, startup) find no accumulator and are not counted.
 */
public final class TokenUsageAccumulator {

    private static final InheritableThreadLocal<TokenUsageAccumulator> CONTEXT =
            new InheritableThreadLocal<>() {
                @Override
                protected TokenUsageAccumulator childValue(TokenUsageAccumulator parent) {
                    return parent;
                }
            };

    private final AtomicLong calls = new AtomicLong(0);
    private final AtomicLong retries = new AtomicLong(0);
    private final AtomicLong promptTokens = new AtomicLong(0);
    private final AtomicLong completionTokens = new AtomicLong(0);

    private TokenUsageAccumulator() {}

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public static TokenUsageAccumulator start() {
        TokenUsageAccumulator acc = new TokenUsageAccumulator();
        CONTEXT.set(acc);
        return acc;
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /** Accumulator bound to the current thread, or {@code null}. */
    public static TokenUsageAccumulator current() {
        return CONTEXT.get();
    }

    // ── Accumulation ─────────────────────────────────────────────────────────

    public void addCall(long prompt, long completion) {
        calls.incrementAndGet();
        promptTokens.addAndGet(prompt);
        completionTokens.addAndGet(completion);
    }

    public void addRetry() {
        retries.incrementAndGet();
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    public long getCalls() {
        return calls.get();
    }

    public long getRetries() {
        return retries.get();
    }

    public long getPromptTokens() {
        return promptTokens.get();
    }

    public long getCompletionTokens() {
        return completionTokens.get();
    }

    public long getTotalTokens() {
        return promptTokens.get() + completionTokens.get();
    }
}
