package com.mikov.emailfinder.cache;

import com.mikov.emailfinder.exception.ResolutionException;
import com.mikov.emailfinder.model.DomainResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-run memo of domain resolutions keyed by normalized company name.
 * Reads are lock-free. Concurrent misses for the same key may both compute; the first value stored wins
 * and every caller gets that value. Failures thrown by the loader are not stored.
 */
public final class DomainCache {
    private final Map<String, DomainResult> cache = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    @FunctionalInterface
    public interface Loader {
        DomainResult load(String key) throws ResolutionException;
    }

    public DomainResult getOrCompute(final String key, final Loader loader) throws ResolutionException {
        final var cached = cache.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        final var computed = loader.load(key);
        final var previous = cache.putIfAbsent(key, computed);
        return previous != null ? previous : computed;
    }

    public DomainResult get(final String key) {
        return cache.get(key);
    }

    public int size() {
        return cache.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }
}
