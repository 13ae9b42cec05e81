package com.pedromossi.clinicache;

import java.time.Duration;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Contract for a single cache storage backend.
 *
 * <p>Two kinds of stores exist: the in-process store, which never fails, and the
 * durable external store, which may be unreachable. Durable implementations signal
 * connectivity problems with {@link com.pedromossi.clinicache.store.BackendUnavailableException}
 * and codec problems with {@link com.pedromossi.clinicache.serializer.SerializationException};
 * both are handled by {@link com.pedromossi.clinicache.store.DualCacheStore} and never reach
 * callers of the cache service.</p>
 *
 * <p>Stores do not interpret expiry. They return whatever they hold and the
 * caller decides whether the entry is still live.</p>
 *
 * <p><strong>Thread Safety:</strong> implementations must be safe for concurrent use.</p>
 *
 * @since 1.0.0
 * @see CacheEntry
 */
public interface CacheStore {

    /**
     * Retrieves the entry stored under a key.
     *
     * <p>The value type lets codec-backed stores rebuild the payload as the caller's type,
     * including parameterized types such as {@code List<ScreeningTypeSummary>}. In-process
     * stores use it as a type check and return {@code null} on mismatch.</p>
     *
     * @param key the cache key (must not be null)
     * @param valueType the expected payload type (must not be null)
     * @return the stored entry, or {@code null} if the key is absent
     */
    CacheEntry get(String key, ParameterizedTypeReference<?> valueType);

    /**
     * Stores an entry, overwriting any previous entry under the same key.
     *
     * @param entry the entry to store (must not be null)
     * @param ttl how long the backend should retain the entry
     */
    void put(CacheEntry entry, Duration ttl);

    /**
     * Removes the entry stored under a key.
     *
     * @param key the cache key
     * @return {@code true} if an entry was removed
     */
    boolean evict(String key);

    /**
     * Removes every entry owned by this store.
     */
    void clear();

    /**
     * Reports the last known reachability of this store.
     *
     * @return {@code true} if the last interaction with the backend succeeded
     */
    default boolean isAvailable() {
        return true;
    }
}
