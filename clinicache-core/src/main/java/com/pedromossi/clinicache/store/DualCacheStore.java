package com.pedromossi.clinicache.store;

import com.pedromossi.clinicache.CacheEntry;
import com.pedromossi.clinicache.CacheStore;
import com.pedromossi.clinicache.local.CaffeineCacheStore;
import com.pedromossi.clinicache.serializer.SerializationException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Backend store combining an optional durable store with the mandatory in-process store.
 *
 * <p><strong>Write path:</strong> every write goes to the durable store first and then to the
 * in-process store. A durable failure (unreachable backend or a value the codec cannot
 * encode) skips only the durable copy.</p>
 *
 * <p><strong>Read path:</strong></p>
 * <ol>
 * <li>Read the durable store.</li>
 * <li>On a durable miss or failure, read the in-process store.</li>
 * </ol>
 * <p>Falling back on a durable miss keeps values whose durable write was skipped readable
 * in this process.</p>
 *
 * <p><strong>Stale durable copies:</strong> when a durable write or delete fails, the durable
 * store may still hold an older value for the key. Such keys are remembered and never read from
 * the durable store again until their old copy has been deleted there. Each later access retries
 * that delete. A failed {@link #clear()} likewise suspends all durable reads until a retried
 * clear succeeds.</p>
 *
 * <p>Durable errors are logged and never propagated. Reachability is exposed through
 * {@link #isDurableAvailable()}.</p>
 *
 * @since 1.0.0
 */
public class DualCacheStore {

    private static final Logger log = LoggerFactory.getLogger(DualCacheStore.class);

    private final CaffeineCacheStore localStore;

    private final CacheStore durableStore;

    private final Set<String> staleDurableKeys = ConcurrentHashMap.newKeySet();

    private volatile boolean durableClearPending;

    /**
     * Creates a new dual store.
     *
     * @param localStore the in-process store (must not be null)
     * @param durableStore the durable store, or empty for in-process-only mode
     */
    public DualCacheStore(CaffeineCacheStore localStore, Optional<CacheStore> durableStore) {
        this.localStore = localStore;
        this.durableStore = durableStore.orElse(null);
        log.info("DualCacheStore initialized. Durable store active: {}", this.durableStore != null);
    }

    /**
     * Reads an entry, preferring the durable copy.
     *
     * @param key the cache key
     * @param valueType the expected payload type
     * @return the entry, or {@code null} if neither store holds the key
     */
    public CacheEntry get(String key, ParameterizedTypeReference<?> valueType) {
        if (durableStore != null && isDurableCopyTrusted(key)) {
            try {
                CacheEntry entry = durableStore.get(key, valueType);
                if (entry != null) {
                    log.debug("Durable store HIT for key: {}", key);
                    return entry;
                }
            } catch (BackendUnavailableException e) {
                log.warn("Durable store unavailable while reading key {}, using in-process store: {}", key, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Error reading key {} from durable store: {}", key, e.getMessage(), e);
            }
        }
        return localStore.get(key, valueType);
    }

    /**
     * Writes an entry to both stores.
     *
     * @param entry the entry to write
     * @param ttl the entry's time to live
     * @return {@code true} once the in-process copy is stored
     */
    public boolean put(CacheEntry entry, Duration ttl) {
        if (durableStore != null) {
            try {
                durableStore.put(entry, ttl);
                staleDurableKeys.remove(entry.getKey());
            } catch (SerializationException e) {
                log.error("Value for key {} cannot be encoded, keeping it in process only: {}",
                        entry.getKey(), e.getMessage(), e);
                markStale(entry.getKey());
            } catch (BackendUnavailableException e) {
                log.warn("Durable store unavailable while writing key {}, keeping it in process only: {}",
                        entry.getKey(), e.getMessage());
                markStale(entry.getKey());
            } catch (RuntimeException e) {
                log.error("Error writing key {} to durable store: {}", entry.getKey(), e.getMessage(), e);
                markStale(entry.getKey());
            }
        }
        localStore.put(entry, ttl);
        return true;
    }

    /**
     * Removes a key from both stores.
     *
     * @param key the cache key
     * @return {@code true} if either store held the key
     */
    public boolean evict(String key) {
        boolean removed = false;
        if (durableStore != null) {
            try {
                removed = durableStore.evict(key);
                staleDurableKeys.remove(key);
            } catch (BackendUnavailableException e) {
                log.warn("Durable store unavailable while deleting key {}: {}", key, e.getMessage());
                markStale(key);
            } catch (RuntimeException e) {
                log.error("Error deleting key {} from durable store: {}", key, e.getMessage(), e);
                markStale(key);
            }
        }
        return localStore.evict(key) || removed;
    }

    /**
     * Empties both stores.
     *
     * @return {@code true} if every store was cleared
     */
    public boolean clear() {
        boolean cleared = true;
        if (durableStore != null) {
            try {
                durableStore.clear();
                durableClearPending = false;
                staleDurableKeys.clear();
            } catch (RuntimeException e) {
                log.error("Error clearing durable store: {}", e.getMessage(), e);
                durableClearPending = true;
                cleared = false;
            }
        }
        localStore.clear();
        return cleared;
    }

    /**
     * @return the number of keys whose durable copy may be outdated and is not read
     */
    public int staleDurableKeyCount() {
        return staleDurableKeys.size();
    }

    /**
     * @return {@code true} while a failed clear keeps every durable copy from being read
     */
    public boolean isDurableClearPending() {
        return durableClearPending;
    }

    private void markStale(String key) {
        staleDurableKeys.add(key);
        log.debug("Durable copy of key {} may be outdated, reading it from process memory only", key);
    }

    /**
     * Retries the pending clear or delete for the key, if any.
     *
     * @return {@code true} if the durable copy of the key can be read
     */
    private boolean isDurableCopyTrusted(String key) {
        if (durableClearPending) {
            try {
                durableStore.clear();
                durableClearPending = false;
                staleDurableKeys.clear();
                log.info("Retried durable clear succeeded, durable reads resumed");
            } catch (RuntimeException e) {
                log.debug("Durable clear still pending: {}", e.getMessage());
                return false;
            }
        }
        if (!staleDurableKeys.contains(key)) {
            return true;
        }
        try {
            durableStore.evict(key);
            staleDurableKeys.remove(key);
            log.debug("Removed outdated durable copy of key {}", key);
        } catch (RuntimeException e) {
            log.debug("Outdated durable copy of key {} could not be removed yet: {}", key, e.getMessage());
        }
        return false;
    }

    /**
     * @return {@code true} if a durable store is configured and was reachable on last contact
     */
    public boolean isDurableAvailable() {
        return durableStore != null && durableStore.isAvailable();
    }

    /**
     * @return {@code true} if a durable store is configured at all
     */
    public boolean hasDurableStore() {
        return durableStore != null;
    }

    /**
     * @return the number of entries held in process
     */
    public long localSize() {
        return localStore.size();
    }

    /**
     * @return a point-in-time copy of the in-process entries
     */
    public List<CacheEntry> localEntries() {
        return localStore.entries();
    }

    /**
     * Registers the callback for in-process capacity evictions.
     *
     * @param listener receives the evicted key
     */
    public void onLocalEviction(Consumer<String> listener) {
        localStore.onEviction(listener);
    }
}
