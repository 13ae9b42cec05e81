package com.pedromossi.clinicache;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A cached value together with its bookkeeping metadata.
 *
 * <p>Entries are immutable. Overwriting a key produces a new entry with a fresh
 * creation timestamp, expiry and version.</p>
 *
 * <p><strong>Expiry:</strong> an entry whose {@code expiresAt} is at or before the
 * current instant is logically absent, regardless of whether a backend still holds it.
 * Entries without an expiry never expire on their own.</p>
 *
 * @since 1.0.0
 * @see CacheStore
 */
public final class CacheEntry {

    private final String key;
    private final Object value;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Set<String> tags;
    private final long version;

    /**
     * Creates a new cache entry.
     *
     * @param key the cache key (must not be null)
     * @param value the cached payload (may be null only for decoded entries)
     * @param createdAt the creation instant (must not be null)
     * @param expiresAt the expiry instant, or {@code null} for no expiry
     * @param tags tags the entry is indexed under (may be null, treated as empty)
     * @param version the monotonic write version
     * @throws IllegalArgumentException if {@code expiresAt} precedes {@code createdAt}
     */
    public CacheEntry(String key, Object value, Instant createdAt, Instant expiresAt, Set<String> tags, long version) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (expiresAt != null && expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("expiresAt must not precede createdAt for key " + key);
        }
        this.value = value;
        this.expiresAt = expiresAt;
        this.tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.version = version;
    }

    /**
     * Creates an entry that expires {@code ttl} after {@code now}.
     *
     * @param key the cache key
     * @param value the cached payload
     * @param now the creation instant
     * @param ttl time to live, must be positive
     * @param tags tags the entry is indexed under
     * @param version the monotonic write version
     * @return the new entry
     */
    public static CacheEntry of(String key, Object value, Instant now, Duration ttl, Set<String> tags, long version) {
        return new CacheEntry(key, value, now, now.plus(ttl), tags, version);
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Set<String> getTags() {
        return tags;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Checks whether this entry is expired at the given instant.
     *
     * @param now the instant to compare against
     * @return {@code true} if the entry has an expiry at or before {@code now}
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * Returns a copy of this entry carrying a different payload.
     *
     * @param newValue the replacement payload
     * @return a new entry with identical metadata
     */
    public CacheEntry withValue(Object newValue) {
        return new CacheEntry(key, newValue, createdAt, expiresAt, tags, version);
    }

    @Override
    public String toString() {
        return "CacheEntry{key='" + key + "', createdAt=" + createdAt + ", expiresAt=" + expiresAt
                + ", tags=" + tags + ", version=" + version + '}';
    }
}
