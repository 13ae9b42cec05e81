package com.pedromossi.clinicache.impl;

import com.pedromossi.clinicache.CacheEntry;
import com.pedromossi.clinicache.CacheService;
import com.pedromossi.clinicache.batch.BatchCoordinator;
import com.pedromossi.clinicache.stats.CacheStats;
import com.pedromossi.clinicache.stats.CacheStatsSnapshot;
import com.pedromossi.clinicache.store.DualCacheStore;
import com.pedromossi.clinicache.tag.TagInvalidation;
import com.pedromossi.clinicache.tag.TagRegistry;
import com.pedromossi.clinicache.trigger.InvalidationContext;
import com.pedromossi.clinicache.trigger.TriggerDispatcher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Tag-indexed cache manager over a {@link DualCacheStore}.
 *
 * <p>The manager owns the per-process cache state: the tag registry, the batch
 * coordinator and the statistics. It is meant to be created once at application startup
 * and shared.</p>
 *
 * <p><strong>Locking:</strong> every operation that touches the stores or that state,
 * reads included, runs under a single {@link ReentrantLock}. Trigger handlers call back
 * into the manager on the dispatching thread, which the reentrant lock allows. Durable
 * calls run inside the lock, so their timeouts bound how long the lock is held.
 * Loaders passed to {@link #getOrLoad} run outside the lock.</p>
 *
 * <p><strong>Expiry:</strong> entries are checked against the injected {@link Clock} on
 * read. An expired entry is deleted on the spot and counted as an expiration (not an
 * eviction). {@link #purgeExpired()} sweeps expired in-process entries that are never
 * read again.</p>
 *
 * @since 1.0.0
 * @see CacheService
 * @see DualCacheStore
 */
public class TaggedCacheManager implements CacheService {

    private static final Logger log = LoggerFactory.getLogger(TaggedCacheManager.class);

    private static final ParameterizedTypeReference<Object> ANY_VALUE = ParameterizedTypeReference.forType(Object.class);

    /**
     * Loads currently in flight, by key. Lets concurrent misses on the same key share
     * a single loader execution.
     */
    private final ConcurrentHashMap<String, Future<Object>> loadingInProgress = new ConcurrentHashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicLong versionSequence = new AtomicLong();

    private final TagRegistry tagRegistry = new TagRegistry();

    private final BatchCoordinator batchCoordinator = new BatchCoordinator();

    private final CacheStats stats = new CacheStats();

    private final DualCacheStore store;

    private final TriggerDispatcher triggerDispatcher;

    private final Duration defaultTtl;

    private final Clock clock;

    /**
     * Creates a manager using the system UTC clock.
     *
     * @see #TaggedCacheManager(DualCacheStore, TriggerDispatcher, Duration, Clock)
     */
    public TaggedCacheManager(DualCacheStore store, TriggerDispatcher triggerDispatcher, Duration defaultTtl) {
        this(store, triggerDispatcher, defaultTtl, Clock.systemUTC());
    }

    /**
     * Creates a new manager.
     *
     * @param store the backend store (must not be null)
     * @param triggerDispatcher the trigger registry, with handlers already registered
     * @param defaultTtl time to live used when a write does not specify one (must be positive)
     * @param clock time source for entry creation and expiry
     * @throws IllegalArgumentException if {@code defaultTtl} is not positive
     */
    public TaggedCacheManager(DualCacheStore store, TriggerDispatcher triggerDispatcher, Duration defaultTtl, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.triggerDispatcher = Objects.requireNonNull(triggerDispatcher, "triggerDispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        this.defaultTtl = defaultTtl;
        this.store.onLocalEviction(this::onLocalEviction);
        log.info("TaggedCacheManager initialized. Durable store active: {}, default TTL: {}, triggers: {}",
                store.hasDurableStore(), defaultTtl, triggerDispatcher.registeredTriggers());
    }

    @Override
    public Object get(String key) {
        return getOrDefault(key, null);
    }

    @Override
    public Object getOrDefault(String key, Object defaultValue) {
        Object value = get(key, ANY_VALUE);
        return value != null ? value : defaultValue;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String key, ParameterizedTypeReference<T> type) {
        Objects.requireNonNull(key, "key must not be null");
        boolean hit = false;
        lock.lock();
        try {
            CacheEntry entry = store.get(key, type);
            if (entry == null) {
                log.debug("Cache MISS for key: {}", key);
                return null;
            }
            if (entry.isExpiredAt(clock.instant())) {
                log.debug("Cache entry EXPIRED for key: {}", key);
                removeExpired(key);
                return null;
            }
            log.debug("Cache HIT for key: {}", key);
            hit = true;
            return (T) entry.getValue();
        } catch (RuntimeException e) {
            log.error("Error reading cache key {}: {}", key, e.getMessage(), e);
            return null;
        } finally {
            stats.recordLookup(hit);
            lock.unlock();
        }
    }

    @Override
    public Object peek(String key) {
        Objects.requireNonNull(key, "key must not be null");
        lock.lock();
        try {
            CacheEntry entry = store.get(key, ANY_VALUE);
            return entry == null || entry.isExpiredAt(clock.instant()) ? null : entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean set(String key, Object value, Duration ttl, Set<String> tags) {
        Objects.requireNonNull(key, "key must not be null");
        if (value == null) {
            log.debug("Refusing to cache null value for key: {}", key);
            return false;
        }
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
        Set<String> effectiveTags = tags == null ? Set.of() : tags;
        lock.lock();
        try {
            CacheEntry entry = CacheEntry.of(key, value, clock.instant(), effectiveTtl, effectiveTags,
                    versionSequence.incrementAndGet());
            boolean stored = store.put(entry, effectiveTtl);
            if (stored) {
                tagRegistry.register(key, entry.getTags());
                stats.recordWrite();
                log.debug("Cached key {} for {} with tags {}", key, effectiveTtl, entry.getTags());
            }
            return stored;
        } catch (RuntimeException e) {
            log.error("Error caching key {}: {}", key, e.getMessage(), e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            return deleteLocked(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int invalidateByTag(String tag) {
        return invalidateTag(tag).getRemovedCount();
    }

    @Override
    public TagInvalidation invalidateTag(String tag) {
        lock.lock();
        try {
            if (batchCoordinator.defer(tag)) {
                log.debug("Batch active, deferring invalidation of tag: {}", tag);
                return TagInvalidation.deferred(tag);
            }
            return TagInvalidation.applied(tag, invalidateTagLocked(tag));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean clearAll() {
        lock.lock();
        try {
            boolean cleared = store.clear();
            tagRegistry.clear();
            log.info("Cleared all cache entries (durable store cleared: {})", cleared);
            return cleared;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStatsSnapshot getStats() {
        lock.lock();
        try {
            return CacheStatsSnapshot.from(stats)
                    .cacheSize(store.localSize())
                    .tagCount(tagRegistry.tagCount())
                    .deferredTagCount(batchCoordinator.deferredCount())
                    .durableAvailable(store.isDurableAvailable())
                    .batchActive(batchCoordinator.isActive())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void triggerInvalidation(String triggerType, InvalidationContext context) {
        log.debug("Firing cache invalidation trigger {} with context {}", triggerType, context);
        triggerDispatcher.dispatch(triggerType, context, this);
    }

    @Override
    public void beginBatch() {
        lock.lock();
        try {
            if (batchCoordinator.begin()) {
                log.info("Batch operation started, deferring tag invalidations");
            } else {
                log.debug("Batch operation already active");
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int endBatch() {
        lock.lock();
        try {
            if (!batchCoordinator.isActive()) {
                log.debug("No active batch operation to end");
                return 0;
            }
            Set<String> deferredTags = batchCoordinator.end();
            int removed = 0;
            for (String tag : deferredTags) {
                removed += invalidateTagLocked(tag);
            }
            log.info("Batch operation ended, invalidated {} entries across {} deferred tags",
                    removed, deferredTags.size());
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isBatchActive() {
        lock.lock();
        try {
            return batchCoordinator.isActive();
        } finally {
            lock.unlock();
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getOrLoad(String key, ParameterizedTypeReference<T> type, Duration ttl, Set<String> tags, Supplier<T> loader) {
        T cached = get(key, type);
        if (cached != null) {
            return cached;
        }

        FutureTask<Object> newTask = new FutureTask<>(() -> {
            log.debug("Loading value for key: {}", key);
            T loaded = loader.get();
            if (loaded != null) {
                set(key, loaded, ttl, tags);
            }
            return loaded;
        });
        Future<Object> running = loadingInProgress.putIfAbsent(key, newTask);
        Future<Object> future = running != null ? running : newTask;
        if (running == null) {
            newTask.run();
        }

        try {
            return (T) future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new CacheLoadingException("Failed to load value for key: " + key, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheLoadingException("Interrupted while loading value for key: " + key, e);
        } finally {
            if (running == null) {
                loadingInProgress.remove(key, newTask);
            }
        }
    }

    @Override
    public int purgeExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int purged = 0;
            for (CacheEntry entry : store.localEntries()) {
                if (entry.isExpiredAt(now)) {
                    removeExpired(entry.getKey());
                    purged++;
                }
            }
            if (purged > 0) {
                log.info("Purged {} expired cache entries", purged);
            }
            return purged;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the trigger registry this manager dispatches to
     */
    public TriggerDispatcher getTriggerDispatcher() {
        return triggerDispatcher;
    }

    /**
     * @return the time to live applied when a write does not specify one
     */
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private boolean deleteLocked(String key) {
        boolean removed = store.evict(key);
        tagRegistry.unregister(key);
        if (removed) {
            stats.recordEviction();
            log.debug("Deleted cache key: {}", key);
        }
        return removed;
    }

    private int invalidateTagLocked(String tag) {
        Set<String> keys = tagRegistry.removeTag(tag);
        int removed = 0;
        for (String key : keys) {
            if (deleteLocked(key)) {
                removed++;
            }
        }
        stats.recordInvalidations(removed);
        if (removed > 0) {
            log.info("Invalidated {} cache entries for tag: {}", removed, tag);
        }
        return removed;
    }

    private void removeExpired(String key) {
        store.evict(key);
        tagRegistry.unregister(key);
        stats.recordExpiration();
    }

    /**
     * Keeps the tag index consistent when the in-process store drops an entry on its own.
     * With a durable store the entry is still live there and stays indexed.
     */
    private void onLocalEviction(String key) {
        if (store.hasDurableStore()) {
            return;
        }
        lock.lock();
        try {
            tagRegistry.unregister(key);
            stats.recordEviction();
        } finally {
            lock.unlock();
        }
    }
}
