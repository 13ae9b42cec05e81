package com.pedromossi.clinicache.stats;

/**
 * Immutable view of a cache manager's counters and state at one instant.
 *
 * @since 1.0.0
 * @see com.pedromossi.clinicache.CacheService#getStats()
 */
public final class CacheStatsSnapshot {

    private final long totalRequests;
    private final long cacheHits;
    private final long cacheMisses;
    private final double hitRatio;
    private final long invalidations;
    private final long evictions;
    private final long expirations;
    private final long writes;
    private final long cacheSize;
    private final int tagCount;
    private final int deferredTagCount;
    private final boolean durableAvailable;
    private final boolean batchActive;

    private CacheStatsSnapshot(Builder builder) {
        this.totalRequests = builder.totalRequests;
        this.cacheHits = builder.cacheHits;
        this.cacheMisses = builder.cacheMisses;
        this.hitRatio = builder.hitRatio;
        this.invalidations = builder.invalidations;
        this.evictions = builder.evictions;
        this.expirations = builder.expirations;
        this.writes = builder.writes;
        this.cacheSize = builder.cacheSize;
        this.tagCount = builder.tagCount;
        this.deferredTagCount = builder.deferredTagCount;
        this.durableAvailable = builder.durableAvailable;
        this.batchActive = builder.batchActive;
    }

    /**
     * Starts a snapshot from the current counter values.
     *
     * @param stats the counters to copy
     * @return a builder pre-filled with the counters
     */
    public static Builder from(CacheStats stats) {
        Builder builder = new Builder();
        builder.totalRequests = stats.totalRequests();
        builder.cacheHits = stats.cacheHits();
        builder.cacheMisses = stats.cacheMisses();
        builder.hitRatio = stats.hitRatio();
        builder.invalidations = stats.invalidations();
        builder.evictions = stats.evictions();
        builder.expirations = stats.expirations();
        builder.writes = stats.writes();
        return builder;
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public long getCacheHits() {
        return cacheHits;
    }

    public long getCacheMisses() {
        return cacheMisses;
    }

    public double getHitRatio() {
        return hitRatio;
    }

    public long getInvalidations() {
        return invalidations;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getExpirations() {
        return expirations;
    }

    public long getWrites() {
        return writes;
    }

    /**
     * @return the number of entries held in process
     */
    public long getCacheSize() {
        return cacheSize;
    }

    public int getTagCount() {
        return tagCount;
    }

    public int getDeferredTagCount() {
        return deferredTagCount;
    }

    /**
     * @return whether the durable store was reachable on last contact
     */
    public boolean isDurableAvailable() {
        return durableAvailable;
    }

    public boolean isBatchActive() {
        return batchActive;
    }

    @Override
    public String toString() {
        return "CacheStatsSnapshot{totalRequests=" + totalRequests + ", cacheHits=" + cacheHits
                + ", cacheMisses=" + cacheMisses + ", hitRatio=" + hitRatio
                + ", invalidations=" + invalidations + ", evictions=" + evictions
                + ", expirations=" + expirations + ", writes=" + writes + ", cacheSize=" + cacheSize
                + ", tagCount=" + tagCount + ", deferredTagCount=" + deferredTagCount
                + ", durableAvailable=" + durableAvailable + ", batchActive=" + batchActive + '}';
    }

    /** Fills in the state that is not held by {@link CacheStats}. */
    public static final class Builder {

        private long totalRequests;
        private long cacheHits;
        private long cacheMisses;
        private double hitRatio;
        private long invalidations;
        private long evictions;
        private long expirations;
        private long writes;
        private long cacheSize;
        private int tagCount;
        private int deferredTagCount;
        private boolean durableAvailable;
        private boolean batchActive;

        private Builder() {
        }

        public Builder cacheSize(long cacheSize) {
            this.cacheSize = cacheSize;
            return this;
        }

        public Builder tagCount(int tagCount) {
            this.tagCount = tagCount;
            return this;
        }

        public Builder deferredTagCount(int deferredTagCount) {
            this.deferredTagCount = deferredTagCount;
            return this;
        }

        public Builder durableAvailable(boolean durableAvailable) {
            this.durableAvailable = durableAvailable;
            return this;
        }

        public Builder batchActive(boolean batchActive) {
            this.batchActive = batchActive;
            return this;
        }

        public CacheStatsSnapshot build() {
            return new CacheStatsSnapshot(this);
        }
    }
}
