package com.pedromossi.clinicache.local;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.pedromossi.clinicache.CacheEntry;
import com.pedromossi.clinicache.CacheStore;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;

/**
 * In-process cache store backed by Caffeine.
 *
 * <p>This store is always present. It mirrors every write so that the cache keeps
 * working when the durable backend is unreachable. Entries live for the lifetime of
 * the process only.</p>
 *
 * <p>The Caffeine instance is built from a specification string. Time-based expiry
 * is handled by the cache manager, so specs normally only bound the size, e.g.
 * {@code maximumSize=10000}. Cache maintenance runs on the calling thread, which makes
 * capacity evictions visible to the {@linkplain #onEviction eviction listener} before
 * the triggering write returns.</p>
 *
 * @since 1.0.0
 * @see CacheStore
 */
public class CaffeineCacheStore implements CacheStore {

    /** Logger instance for this class */
    private static final Logger log = LoggerFactory.getLogger(CaffeineCacheStore.class);

    private final Cache<String, CacheEntry> cache;

    private volatile Consumer<String> evictionListener = key -> { };

    /**
     * Creates a new store from a Caffeine specification.
     *
     * @param spec Caffeine cache specification string (e.g. "maximumSize=10000")
     * @throws IllegalArgumentException if the specification string is invalid
     * @see Caffeine#from(String)
     */
    public CaffeineCacheStore(String spec) {
        this.cache = Caffeine.from(spec)
                .executor(Runnable::run)
                .evictionListener((String key, CacheEntry entry, RemovalCause cause) -> {
                    if (key != null && cause.wasEvicted()) {
                        log.debug("In-process entry evicted for key: {} (cause: {})", key, cause);
                        evictionListener.accept(key);
                    }
                })
                .build();
        log.info("CaffeineCacheStore initialized with specification: {}", spec);
    }

    /**
     * Registers the callback notified when Caffeine evicts an entry on its own,
     * e.g. because the size bound was reached. Explicit removals are not reported.
     *
     * @param listener receives the evicted key
     */
    public void onEviction(Consumer<String> listener) {
        this.evictionListener = listener == null ? key -> { } : listener;
    }

    /**
     * Retrieves an entry, checking its payload against the requested type.
     *
     * @return the entry, or {@code null} if absent or the payload is of another type
     */
    @Override
    public CacheEntry get(String key, ParameterizedTypeReference<?> valueType) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return null;
        }
        Class<?> rawClass = rawClassOf(valueType.getType());
        if (rawClass == null || rawClass.isInstance(entry.getValue())) {
            return entry;
        }
        log.debug("In-process entry for key {} holds {} but {} was requested",
                key, entry.getValue().getClass().getName(), rawClass.getName());
        return null;
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        cache.put(entry.getKey(), entry);
    }

    @Override
    public boolean evict(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    /**
     * @return the number of entries currently held
     */
    public long size() {
        return cache.asMap().size();
    }

    /**
     * Returns a point-in-time copy of the held entries.
     *
     * @return the entries, in no particular order
     */
    public List<CacheEntry> entries() {
        return new ArrayList<>(cache.asMap().values());
    }

    /**
     * Runs pending Caffeine maintenance, such as size-based eviction.
     */
    public void cleanUp() {
        cache.cleanUp();
    }

    /**
     * Retrieves the underlying native Caffeine cache instance.
     *
     * @return the native Caffeine cache instance
     */
    public Cache<String, CacheEntry> getNativeCache() {
        return cache;
    }

    private static Class<?> rawClassOf(Type type) {
        if (type instanceof Class<?> clazz) {
            return clazz;
        }
        if (type instanceof ParameterizedType parameterized && parameterized.getRawType() instanceof Class<?> raw) {
            return raw;
        }
        // Wildcards and type variables cannot be checked at runtime.
        return null;
    }
}
