package com.pedromossi.clinicache.stats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic operation counters of a cache manager.
 *
 * <p>Counters only ever grow. They are atomic so that metric exporters can read them
 * without taking the manager's lock.</p>
 *
 * @since 1.0.0
 */
public class CacheStats {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();

    /**
     * Records one read request and its outcome.
     *
     * @param hit whether the read found a live entry
     */
    public void recordLookup(boolean hit) {
        totalRequests.incrementAndGet();
        if (hit) {
            cacheHits.incrementAndGet();
        } else {
            cacheMisses.incrementAndGet();
        }
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public void recordInvalidations(long count) {
        invalidations.addAndGet(count);
    }

    public void recordExpiration() {
        expirations.incrementAndGet();
    }

    public void recordWrite() {
        writes.incrementAndGet();
    }

    public long totalRequests() {
        return totalRequests.get();
    }

    public long cacheHits() {
        return cacheHits.get();
    }

    public long cacheMisses() {
        return cacheMisses.get();
    }

    public long invalidations() {
        return invalidations.get();
    }

    public long evictions() {
        return evictions.get();
    }

    public long expirations() {
        return expirations.get();
    }

    public long writes() {
        return writes.get();
    }

    /**
     * @return hits divided by requests, or 0 when nothing was requested yet
     */
    public double hitRatio() {
        long requests = totalRequests.get();
        return requests == 0 ? 0.0 : (double) cacheHits.get() / requests;
    }
}
