package com.mikov.emailfinder.pipeline;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Token bucket per destination domain so that no single mail server receives a burst of probes.
 */
@Slf4j
public class DomainRateLimiter {
    private static final Duration WAIT_SLICE = Duration.ofMillis(200);

    private final int permitsPerSecond;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    /**
     * @param permitsPerSecond sustained rate and burst size per domain; zero or less disables limiting
     */
    public DomainRateLimiter(final int permitsPerSecond) {
        this.permitsPerSecond = permitsPerSecond;
    }

    /**
     * Blocks until a token for the domain is available.
     *
     * @param cancelled checked between waits so a cancelled run is not held here
     * @return false if the wait was abandoned because of cancellation or interruption
     */
    public boolean acquire(final String domain, final BooleanSupplier cancelled) {
        if (permitsPerSecond <= 0) {
            return true;
        }
        final Bucket bucket = buckets.computeIfAbsent(domain, key -> newBucket());
        try {
            while (true) {
                final ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
                if (probe.isConsumed()) {
                    return true;
                }
                if (cancelled.getAsBoolean()) {
                    return false;
                }
                TimeUnit.NANOSECONDS.sleep(Math.min(probe.getNanosToWaitForRefill(), WAIT_SLICE.toNanos()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for a {} token", domain);
            return false;
        }
    }

    private Bucket newBucket() {
        final Bandwidth limit = Bandwidth.classic(permitsPerSecond,
                Refill.greedy(permitsPerSecond, Duration.ofSeconds(1)));
        return Bucket.builder().addLimit(limit).build();
    }

    public int trackedDomains() {
        return buckets.size();
    }
}
