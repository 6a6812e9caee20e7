package com.classsched.classsched_api.solver.search;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock and node limits shared by all workers of one solve. Workers call
 * {@link #tick()} once per visited node and stop as soon as it returns false.
 */
public final class SearchBudget {

    private static final long CLOCK_CHECK_MASK = 0xFF;

    private final long startNanos;
    private final long timeLimitNanos;
    private final long maxNodes;
    private final AtomicLong nodes = new AtomicLong();
    private volatile boolean exhausted;

    private SearchBudget(Duration maxTime, long maxNodes) {
        this.startNanos = System.nanoTime();
        this.timeLimitNanos = maxTime == null ? Long.MAX_VALUE : maxTime.toNanos();
        this.maxNodes = maxNodes <= 0 ? Long.MAX_VALUE : maxNodes;
    }

    /**
     * @param maxTime null for no time limit
     * @param maxNodes zero or negative for no node limit
     */
    public static SearchBudget of(Duration maxTime, long maxNodes) {
        return new SearchBudget(maxTime, maxNodes);
    }

    public static SearchBudget unlimited() {
        return new SearchBudget(null, 0L);
    }

    public boolean tick() {
        if (exhausted) {
            return false;
        }
        long visited = nodes.incrementAndGet();
        if (visited > maxNodes) {
            exhausted = true;
            return false;
        }
        if ((visited & CLOCK_CHECK_MASK) == 0 && System.nanoTime() - startNanos > timeLimitNanos) {
            exhausted = true;
            return false;
        }
        return true;
    }

    /** Stops every worker at its next node. */
    public void exhaust() {
        exhausted = true;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public long getNodes() {
        return Math.min(nodes.get(), maxNodes);
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
