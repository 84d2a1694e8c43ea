package com.mikov.emailfinder.pipeline;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts consecutive contacts whose lookups could not reach DNS. Any success resets the count.
 */
class CapabilityFailureTracker {
    private final int threshold;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    CapabilityFailureTracker(final int threshold) {
        this.threshold = threshold;
    }

    void recordSuccess() {
        consecutiveFailures.set(0);
    }

    /**
     * @return true once the threshold is reached
     */
    boolean recordFailure() {
        final int failures = consecutiveFailures.incrementAndGet();
        return threshold > 0 && failures >= threshold;
    }

    int consecutiveFailures() {
        return consecutiveFailures.get();
    }
}
