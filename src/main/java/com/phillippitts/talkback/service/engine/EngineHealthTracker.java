package com.phillippitts.talkback.service.engine;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts consecutive failures of an engine.
 *
 * <p>An engine is reported unhealthy once the count reaches the threshold; any success resets
 * it. Cancelled calls count as neither.
 */
public final class EngineHealthTracker {

    /** Consecutive failures before an engine reports unhealthy. */
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;

    private final int failureThreshold;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public EngineHealthTracker() {
        this(DEFAULT_FAILURE_THRESHOLD);
    }

    public EngineHealthTracker(int failureThreshold) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive, got: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
    }

    public void recordFailure() {
        consecutiveFailures.incrementAndGet();
    }

    public boolean isHealthy() {
        return consecutiveFailures.get() < failureThreshold;
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }
}
