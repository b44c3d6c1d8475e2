package com.ethixai.drift.service;

import com.ethixai.drift.exception.CycleTimeoutException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wall-clock budget of one drift cycle, checked between steps. {@link #expire()} lets the caller abort a cycle
 * that is still running on another thread.
 * <p>
 * The cycle and the caller race on one decision: either the cycle claims its commit before the caller gives up,
 * or the caller expires the cycle before it commits. Exactly one of them wins, so a cycle reported as timed out
 * never leaves a committed snapshot behind.
 */
public class CycleDeadline {

    private static final int OPEN = 0;
    private static final int EXPIRED = 1;
    private static final int COMMITTING = 2;

    private final long deadlineNanos;
    private final Duration budget;
    private final AtomicInteger state = new AtomicInteger(OPEN);

    public CycleDeadline(Duration budget) {
        this.budget = budget;
        this.deadlineNanos = System.nanoTime() + budget.toNanos();
    }

    /**
     * Expires the cycle unless it already claimed its commit.
     *
     * @return false when the commit was claimed first and the cycle's own outcome stands
     */
    public boolean expire() {
        return state.compareAndSet(OPEN, EXPIRED) || state.get() == EXPIRED;
    }

    public boolean isExpired() {
        int current = state.get();
        return current == EXPIRED || (current == OPEN && System.nanoTime() - deadlineNanos >= 0);
    }

    public void check(String step) {
        if (isExpired()) {
            throw new CycleTimeoutException("Cycle exceeded " + budget + " before " + step);
        }
    }

    /**
     * Last check before the transaction commits. Once claimed, {@link #expire()} no longer aborts the cycle.
     */
    public void claimCommit() {
        if (System.nanoTime() - deadlineNanos >= 0) {
            state.compareAndSet(OPEN, EXPIRED);
        }
        if (!state.compareAndSet(OPEN, COMMITTING)) {
            throw new CycleTimeoutException("Cycle exceeded " + budget + " before commit");
        }
    }

    /**
     * Hands the decision back after a commit that failed, so a retried attempt can still be expired.
     */
    public void releaseCommit() {
        state.compareAndSet(COMMITTING, OPEN);
    }

    public int remainingSeconds() {
        long remaining = deadlineNanos - System.nanoTime();
        return (int) Math.max(1, Duration.ofNanos(Math.max(remaining, 0)).toSeconds() + 1);
    }
}
