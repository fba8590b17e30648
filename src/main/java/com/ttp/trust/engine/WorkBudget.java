package com.ttp.trust.engine;

import com.ttp.trust.api.Truncation;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared cancellation state for one query's enumeration workers.
 *
 * <p>
 * Workers call {@link #tryVisit()} before expanding a principal. Once the
 * node budget is spent, the deadline has passed or a worker was interrupted,
 * every later call returns {@code false} and the first reason sticks.
 * {@link Truncation#FAN_OUT} is recorded too, but it does not stop the
 * search.
 */
public final class WorkBudget {
    private final int maxNodes;
    private final long deadlineNanos;
    private final AtomicInteger visited = new AtomicInteger();
    private final AtomicReference<Truncation> stopReason = new AtomicReference<>(Truncation.NONE);
    private volatile boolean fanOutLimited;

    public WorkBudget(int maxNodes, long timeoutMillis) {
        this.maxNodes = maxNodes;
        this.deadlineNanos = System.nanoTime() + timeoutMillis * 1_000_000L;
    }

    /**
     * Claims one node visit.
     *
     * @return false if the search must stop
     */
    public boolean tryVisit() {
        if (isCancelled())
            return false;
        if (Thread.currentThread().isInterrupted() || System.nanoTime() - deadlineNanos > 0) {
            cancel(Truncation.DEADLINE);
            return false;
        }
        if (visited.incrementAndGet() > maxNodes) {
            visited.decrementAndGet();
            cancel(Truncation.NODE_BUDGET);
            return false;
        }
        return true;
    }

    public void cancel(Truncation reason) {
        stopReason.compareAndSet(Truncation.NONE, reason);
    }

    public boolean isCancelled() {
        return stopReason.get() != Truncation.NONE;
    }

    public void markFanOutLimited() {
        fanOutLimited = true;
    }

    /** Nanoseconds left before the deadline, never negative. */
    public long remainingNanos() {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    public int visited() {
        return visited.get();
    }

    /** The stop reason if the search was cancelled, else FAN_OUT or NONE. */
    public Truncation truncation() {
        Truncation stop = stopReason.get();
        if (stop != Truncation.NONE)
            return stop;
        return fanOutLimited ? Truncation.FAN_OUT : Truncation.NONE;
    }
}
