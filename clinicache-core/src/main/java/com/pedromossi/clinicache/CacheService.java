package com.pedromossi.clinicache;

import com.pedromossi.clinicache.stats.CacheStatsSnapshot;
import com.pedromossi.clinicache.tag.TagInvalidation;
import com.pedromossi.clinicache.trigger.InvalidationContext;
import java.time.Duration;
import java.util.Set;
import java.util.function.Supplier;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Main interface of the clinic cache: a tag-indexed, TTL-based key/value cache with
 * trigger-driven invalidation.
 *
 * <p>Values are written with a time to live and a set of tags. Tags group entries by the
 * domain data they were derived from (e.g. {@code patient_42}) so that a change to that
 * data can invalidate every derived entry at once, either directly through
 * {@link #invalidateByTag(String)} or through a named trigger
 * ({@link #triggerInvalidation(String, InvalidationContext)}).</p>
 *
 * <p>While a batch is active, tag invalidations are deferred and executed once per
 * distinct tag when the batch ends.</p>
 *
 * <p>Backend failures never surface through this interface. Reads degrade to misses
 * and writes degrade to in-process only.</p>
 *
 * @since 1.0.0
 */
public interface CacheService {

    /**
     * Reads a live value.
     *
     * @param key the cache key
     * @return the value, or {@code null} if absent or expired
     */
    Object get(String key);

    /**
     * Reads a live value, returning a fallback on a miss.
     *
     * @param key the cache key
     * @param defaultValue returned when the key is absent or expired
     * @return the cached value or {@code defaultValue}
     */
    Object getOrDefault(String key, Object defaultValue);

    /**
     * Reads a live value as the given type.
     *
     * <p>The type lets the durable store decode complex generic types such as
     * {@code List<ScreeningTypeSummary>}.</p>
     *
     * @param <T> the expected value type
     * @param key the cache key
     * @param type the expected value type
     * @return the value, or {@code null} if absent, expired or of another type
     */
    <T> T get(String key, ParameterizedTypeReference<T> type);

    /**
     * Reads a live value without recording a request, hit or miss.
     *
     * <p>Meant for administrative inspection, which must not skew the hit ratio.</p>
     *
     * @param key the cache key
     * @return the value, or {@code null} if absent or expired
     */
    Object peek(String key);

    /**
     * Writes a value with the default time to live and no tags.
     *
     * @see #set(String, Object, Duration, Set)
     */
    default boolean set(String key, Object value) {
        return set(key, value, null, Set.of());
    }

    /**
     * Writes a value with the default time to live.
     *
     * @see #set(String, Object, Duration, Set)
     */
    default boolean set(String key, Object value, Set<String> tags) {
        return set(key, value, null, tags);
    }

    /**
     * Writes a value and indexes it under the given tags.
     *
     * <p>Overwriting a key replaces its value, expiry and tags.</p>
     *
     * @param key the cache key (must not be null)
     * @param value the value (null values are not cached)
     * @param ttl time to live; {@code null}, zero or negative selects the default
     * @param tags tags to index the entry under (may be empty)
     * @return {@code true} if the value was stored
     */
    boolean set(String key, Object value, Duration ttl, Set<String> tags);

    /**
     * Deletes a key.
     *
     * @param key the cache key
     * @return {@code true} if an entry was removed
     */
    boolean delete(String key);

    /**
     * Deletes every entry indexed under a tag.
     *
     * <p>While a batch is active the tag is deferred instead and this returns 0.</p>
     *
     * @param tag the tag
     * @return the number of entries deleted
     */
    int invalidateByTag(String tag);

    /**
     * Same as {@link #invalidateByTag(String)}, also reporting whether an active batch deferred
     * the tag. Both are decided in one step.
     *
     * @param tag the tag
     * @return the outcome
     */
    TagInvalidation invalidateTag(String tag);

    /**
     * Removes every entry and every tag.
     *
     * @return {@code true} if all stores were cleared
     */
    boolean clearAll();

    /**
     * @return a consistent snapshot of counters and state
     */
    CacheStatsSnapshot getStats();

    /**
     * Fires a named trigger. Unknown triggers are logged and ignored.
     *
     * @param triggerType the trigger name, e.g. {@code patient_demographic_change}
     * @param context the event payload (may be null)
     */
    void triggerInvalidation(String triggerType, InvalidationContext context);

    /**
     * Opens a batch window. Opening while a batch is active has no effect.
     */
    void beginBatch();

    /**
     * Closes the batch window and invalidates each deferred tag once.
     *
     * @return the number of entries deleted, 0 if no batch was active
     */
    int endBatch();

    boolean isBatchActive();

    /**
     * Runs work inside a batch window, closing it even if the work fails.
     *
     * @param <T> the result type
     * @param work the bulk operation
     * @return the work's result
     */
    default <T> T inBatch(Supplier<T> work) {
        beginBatch();
        try {
            return work.get();
        } finally {
            endBatch();
        }
    }

    /**
     * Returns the cached value or loads, caches and returns it.
     *
     * <p>Concurrent misses on the same key share one loader execution. A {@code null}
     * result is returned but not cached.</p>
     *
     * @param <T> the value type
     * @param key the cache key
     * @param type the value type
     * @param ttl time to live of the loaded value ({@code null} selects the default)
     * @param tags tags of the loaded value
     * @param loader computes the value on a miss
     * @return the cached or loaded value
     * @throws com.pedromossi.clinicache.impl.CacheLoadingException if the load is interrupted
     */
    <T> T getOrLoad(String key, ParameterizedTypeReference<T> type, Duration ttl, Set<String> tags, Supplier<T> loader);

    /**
     * Deletes every in-process entry that has expired.
     *
     * @return the number of entries removed
     */
    int purgeExpired();
}
