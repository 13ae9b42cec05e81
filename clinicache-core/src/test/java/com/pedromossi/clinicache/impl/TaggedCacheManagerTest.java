package com.pedromossi.clinicache.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.pedromossi.clinicache.MutableClock;
import com.pedromossi.clinicache.local.CaffeineCacheStore;
import com.pedromossi.clinicache.stats.CacheStatsSnapshot;
import com.pedromossi.clinicache.store.DualCacheStore;
import com.pedromossi.clinicache.trigger.TriggerDispatcher;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.ParameterizedTypeReference;

@DisplayName("TaggedCacheManager")
class TaggedCacheManagerTest {

    private static final String KEY = "patient_demographics:42";
    private static final String VALUE = "demographics";
    private static final ParameterizedTypeReference<String> TYPE_REF = new ParameterizedTypeReference<>() {};

    private MutableClock clock;
    private TaggedCacheManager cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T09:00:00Z");
        DualCacheStore store = new DualCacheStore(new CaffeineCacheStore("maximumSize=1000"), Optional.empty());
        cache = new TaggedCacheManager(store, new TriggerDispatcher(), Duration.ofHours(1), clock);
    }

    @Test
    @DisplayName("should reject a non-positive default TTL")
    void shouldRejectNonPositiveDefaultTtl() {
        DualCacheStore store = new DualCacheStore(new CaffeineCacheStore("maximumSize=10"), Optional.empty());
        assertThatThrownBy(() -> new TaggedCacheManager(store, new TriggerDispatcher(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("should return a value before its TTL and nothing after")
        void shouldExpireAfterTtl() {
            cache.set(KEY, VALUE, Duration.ofSeconds(60), Set.of());

            clock.advance(Duration.ofSeconds(59));
            assertThat(cache.get(KEY)).isEqualTo(VALUE);

            clock.advance(Duration.ofSeconds(2));
            assertThat(cache.get(KEY)).isNull();

            CacheStatsSnapshot stats = cache.getStats();
            assertThat(stats.getExpirations()).isEqualTo(1);
            assertThat(stats.getEvictions()).isZero();
            assertThat(stats.getCacheSize()).isZero();
        }

        @Test
        @DisplayName("should treat an entry as expired exactly at its expiry instant")
        void shouldExpireAtBoundary() {
            cache.set(KEY, VALUE, Duration.ofSeconds(60), Set.of());
            clock.advance(Duration.ofSeconds(60));
            assertThat(cache.get(KEY)).isNull();
        }

        @Test
        @DisplayName("should apply the default TTL when none or a non-positive one is given")
        void shouldApplyDefaultTtl() {
            cache.set("a", VALUE);
            cache.set("b", VALUE, Duration.ofSeconds(-5), Set.of());

            clock.advance(Duration.ofMinutes(59));
            assertThat(cache.get("a")).isEqualTo(VALUE);
            assertThat(cache.get("b")).isEqualTo(VALUE);

            clock.advance(Duration.ofMinutes(2));
            assertThat(cache.get("a")).isNull();
            assertThat(cache.get("b")).isNull();
        }

        @Test
        @DisplayName("should drop the expired key from its tags")
        void shouldUnindexExpiredKey() {
            cache.set(KEY, VALUE, Duration.ofSeconds(10), Set.of("patient_42"));
            clock.advance(Duration.ofSeconds(11));

            assertThat(cache.get(KEY)).isNull();
            assertThat(cache.invalidateByTag("patient_42")).isZero();
            assertThat(cache.getStats().getTagCount()).isZero();
        }

        @Test
        @DisplayName("purgeExpired() should remove only expired entries")
        void shouldPurgeExpired() {
            cache.set("short:1", VALUE, Duration.ofSeconds(10), Set.of("t"));
            cache.set("short:2", VALUE, Duration.ofSeconds(10), Set.of("t"));
            cache.set("long:1", VALUE, Duration.ofHours(1), Set.of("t"));
            clock.advance(Duration.ofSeconds(11));

            assertThat(cache.purgeExpired()).isEqualTo(2);

            CacheStatsSnapshot stats = cache.getStats();
            assertThat(stats.getCacheSize()).isEqualTo(1);
            assertThat(stats.getExpirations()).isEqualTo(2);
            assertThat(cache.get("long:1")).isEqualTo(VALUE);
            assertThat(cache.purgeExpired()).isZero();
        }
    }

    @Nested
    @DisplayName("Writes and deletes")
    class WritesAndDeletes {

        @Test
        @DisplayName("should reject null values without storing anything")
        void shouldRejectNullValues() {
            assertThat(cache.set(KEY, null)).isFalse();
            assertThat(cache.get(KEY)).isNull();
            assertThat(cache.getStats().getWrites()).isZero();
        }

        @Test
        @DisplayName("should be idempotent for repeated writes of the same value")
        void shouldBeIdempotent() {
            cache.set(KEY, VALUE, Set.of("patient_42"));
            cache.set(KEY, VALUE, Set.of("patient_42"));

            assertThat(cache.get(KEY)).isEqualTo(VALUE);
            assertThat(cache.getStats().getCacheSize()).isEqualTo(1);
            assertThat(cache.invalidateByTag("patient_42")).isEqualTo(1);
        }

        @Test
        @DisplayName("should re-index a key under the tags of its latest write")
        void shouldReindexOnOverwrite() {
            cache.set(KEY, "v1", Set.of("old"));
            cache.set(KEY, "v2", Set.of("new"));

            assertThat(cache.invalidateByTag("old")).isZero();
            assertThat(cache.get(KEY)).isEqualTo("v2");
            assertThat(cache.invalidateByTag("new")).isEqualTo(1);
            assertThat(cache.get(KEY)).isNull();
        }

        @Test
        @DisplayName("delete() should report whether an entry was removed")
        void shouldDelete() {
            cache.set(KEY, VALUE);

            assertThat(cache.delete(KEY)).isTrue();
            assertThat(cache.delete(KEY)).isFalse();
            assertThat(cache.get(KEY)).isNull();
            assertThat(cache.getStats().getEvictions()).isEqualTo(1);
        }

        @Test
        @DisplayName("clearAll() should drop every entry and tag")
        void shouldClearAll() {
            cache.set("a", VALUE, Set.of("t1"));
            cache.set("b", VALUE, Set.of("t2"));

            assertThat(cache.clearAll()).isTrue();

            CacheStatsSnapshot stats = cache.getStats();
            assertThat(stats.getCacheSize()).isZero();
            assertThat(stats.getTagCount()).isZero();
            assertThat(cache.invalidateByTag("t1")).isZero();
        }

        @Test
        @DisplayName("getOrDefault() should return the default only on a miss")
        void shouldReturnDefaultOnMiss() {
            assertThat(cache.getOrDefault(KEY, "fallback")).isEqualTo("fallback");
            cache.set(KEY, VALUE);
            assertThat(cache.getOrDefault(KEY, "fallback")).isEqualTo(VALUE);
        }

        @Test
        @DisplayName("typed get() should miss when the cached value has another type")
        void shouldMissOnTypeMismatch() {
            cache.set(KEY, 42);
            assertThat(cache.get(KEY, TYPE_REF)).isNull();
            assertThat(cache.get(KEY, new ParameterizedTypeReference<Integer>() {})).isEqualTo(42);
        }
    }

    @Nested
    @DisplayName("Tag invalidation")
    class TagInvalidation {

        @Test
        @DisplayName("should remove every key under a tag and report the count")
        void shouldInvalidateTag() {
            cache.set("a", VALUE, Set.of("t1", "t2"));
            cache.set("b", VALUE, Set.of("t1"));
            cache.set("c", VALUE, Set.of("t3"));

            assertThat(cache.invalidateByTag("t1")).isEqualTo(2);

            assertThat(cache.get("a")).isNull();
            assertThat(cache.get("b")).isNull();
            assertThat(cache.get("c")).isEqualTo(VALUE);
            assertThat(cache.invalidateByTag("t1")).isZero();
            assertThat(cache.invalidateByTag("t2")).isZero();
        }

        @Test
        @DisplayName("should return 0 for an unknown tag")
        void shouldIgnoreUnknownTag() {
            assertThat(cache.invalidateByTag("nope")).isZero();
            assertThat(cache.getStats().getInvalidations()).isZero();
        }

        @Test
        @DisplayName("should count invalidations and evictions")
        void shouldCountInvalidations() {
            cache.set("a", VALUE, Set.of("t"));
            cache.set("b", VALUE, Set.of("t"));
            cache.invalidateByTag("t");

            CacheStatsSnapshot stats = cache.getStats();
            assertThat(stats.getInvalidations()).isEqualTo(2);
            assertThat(stats.getEvictions()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("should count every read as exactly one hit or miss")
        void shouldCountLookups() {
            cache.get(KEY);
            cache.set(KEY, VALUE, Set.of("patient_42"));
            cache.get(KEY);
            cache.get(KEY);

            CacheStatsSnapshot stats = cache.getStats();
            assertThat(stats.getTotalRequests()).isEqualTo(3);
            assertThat(stats.getCacheHits()).isEqualTo(2);
            assertThat(stats.getCacheMisses()).isEqualTo(1);
            assertThat(stats.getHitRatio()).isEqualTo(2.0 / 3.0);
            assertThat(stats.getWrites()).isEqualTo(1);
            assertThat(stats.getCacheSize()).isEqualTo(1);
            assertThat(stats.getTagCount()).isEqualTo(1);
            assertThat(stats.isDurableAvailable()).isFalse();
            assertThat(stats.isBatchActive()).isFalse();
        }

        @Test
        @DisplayName("should report a zero hit ratio before any request")
        void shouldReportZeroHitRatio() {
            assertThat(cache.getStats().getHitRatio()).isZero();
        }

        @Test
        @DisplayName("peek() should read live values without counting requests")
        void shouldPeekWithoutCounting() {
            cache.set(KEY, VALUE, Duration.ofSeconds(30), Set.of());

            assertThat(cache.peek(KEY)).isEqualTo(VALUE);
            assertThat(cache.peek("missing")).isNull();
            clock.advance(Duration.ofSeconds(31));
            assertThat(cache.peek(KEY)).isNull();

            CacheStatsSnapshot stats = cache.getStats();
            assertThat(stats.getTotalRequests()).isZero();
            assertThat(stats.getExpirations()).isZero();
        }
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("invalidateTag() should report whether the tag was deferred")
        void shouldReportDeferral() {
            cache.set("a", VALUE, Set.of("t1"));

            cache.beginBatch();
            var deferred = cache.invalidateTag("t1");
            assertThat(deferred.isDeferred()).isTrue();
            assertThat(deferred.getRemovedCount()).isZero();
            cache.endBatch();

            cache.set("b", VALUE, Set.of("t2"));
            var applied = cache.invalidateTag("t2");
            assertThat(applied.isDeferred()).isFalse();
            assertThat(applied.getRemovedCount()).isEqualTo(1);
            assertThat(applied.getTag()).isEqualTo("t2");
        }

        @Test
        @DisplayName("should defer tag invalidations until the batch ends")
        void shouldDeferUntilEnd() {
            cache.set("a", VALUE, Set.of("t1"));
            cache.set("b", VALUE, Set.of("t2"));

            cache.beginBatch();
            assertThat(cache.invalidateByTag("t1")).isZero();
            assertThat(cache.invalidateByTag("t2")).isZero();
            assertThat(cache.get("a")).isEqualTo(VALUE);
            assertThat(cache.getStats().getDeferredTagCount()).isEqualTo(2);

            assertThat(cache.endBatch()).isEqualTo(2);
            assertThat(cache.get("a")).isNull();
            assertThat(cache.get("b")).isNull();
            assertThat(cache.isBatchActive()).isFalse();
        }

        @Test
        @DisplayName("should invalidate a tag requested several times in a batch only once")
        void shouldCoalesceRepeatedTags() {
            cache.set("a", VALUE, Set.of("t"));
            cache.set("b", VALUE, Set.of("t"));

            cache.beginBatch();
            cache.invalidateByTag("t");
            cache.invalidateByTag("t");
            cache.invalidateByTag("t");
            cache.endBatch();

            CacheStatsSnapshot stats = cache.getStats();
            assertThat(stats.getEvictions()).isEqualTo(2);
            assertThat(stats.getInvalidations()).isEqualTo(2);
        }

        @Test
        @DisplayName("should treat a nested begin as a no-op and flush on the first end")
        void shouldUseFlagSemanticsForNestedBatches() {
            cache.set("a", VALUE, Set.of("t"));

            cache.beginBatch();
            cache.beginBatch();
            cache.invalidateByTag("t");

            assertThat(cache.endBatch()).isEqualTo(1);
            assertThat(cache.isBatchActive()).isFalse();
            assertThat(cache.endBatch()).isZero();
        }

        @Test
        @DisplayName("should not defer deletes or writes")
        void shouldNotDeferDeletes() {
            cache.beginBatch();
            cache.set(KEY, VALUE);
            assertThat(cache.get(KEY)).isEqualTo(VALUE);
            assertThat(cache.delete(KEY)).isTrue();
            cache.endBatch();
        }

        @Test
        @DisplayName("inBatch() should end the batch even when the work fails")
        void shouldEndBatchOnFailure() {
            cache.set("a", VALUE, Set.of("t"));

            assertThatThrownBy(() -> cache.inBatch(() -> {
                cache.invalidateByTag("t");
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(cache.isBatchActive()).isFalse();
            assertThat(cache.get("a")).isNull();
        }
    }

    @Nested
    @DisplayName("getOrLoad()")
    class GetOrLoad {

        @Test
        @DisplayName("should load once on a miss and serve later reads from the cache")
        @SuppressWarnings("unchecked")
        void shouldMemoize() {
            Supplier<String> loader = mock(Supplier.class);
            when(loader.get()).thenReturn(VALUE);

            assertThat(cache.getOrLoad(KEY, TYPE_REF, Duration.ofMinutes(5), Set.of("patient_42"), loader)).isEqualTo(VALUE);
            assertThat(cache.getOrLoad(KEY, TYPE_REF, Duration.ofMinutes(5), Set.of("patient_42"), loader)).isEqualTo(VALUE);

            verify(loader, times(1)).get();
            assertThat(cache.invalidateByTag("patient_42")).isEqualTo(1);
        }

        @Test
        @DisplayName("should not cache a null result")
        @SuppressWarnings("unchecked")
        void shouldNotCacheNull() {
            Supplier<String> loader = mock(Supplier.class);
            when(loader.get()).thenReturn(null);

            assertThat(cache.getOrLoad(KEY, TYPE_REF, null, Set.of(), loader)).isNull();
            assertThat(cache.getOrLoad(KEY, TYPE_REF, null, Set.of(), loader)).isNull();

            verify(loader, times(2)).get();
        }

        @Test
        @DisplayName("should propagate a loader's runtime exception unchanged")
        void shouldPropagateRuntimeException() {
            IllegalStateException failure = new IllegalStateException("database down");

            assertThatThrownBy(() -> cache.getOrLoad(KEY, TYPE_REF, null, Set.of(), () -> {
                throw failure;
            })).isSameAs(failure);
            assertThat(cache.get(KEY)).isNull();
        }

        @Test
        @DisplayName("should load generic collection types")
        void shouldLoadGenericTypes() {
            var listType = new ParameterizedTypeReference<List<String>>() {};
            List<String> loaded = cache.getOrLoad("document_types", listType, null, Set.of(), () -> List.of("lab", "imaging"));

            assertThat(loaded).containsExactly("lab", "imaging");
            assertThat(cache.get("document_types", listType)).containsExactly("lab", "imaging");
        }
    }

    @Nested
    @DisplayName("Concurrency and interruption")
    class Concurrency {

        private ExecutorService executor;

        @BeforeEach
        void setUpExecutor() {
            executor = Executors.newFixedThreadPool(2);
        }

        @AfterEach
        void shutdownExecutor() throws InterruptedException {
            executor.shutdownNow();
            executor.awaitTermination(1, TimeUnit.SECONDS);
        }

        @Test
        @DisplayName("should execute the loader only once for concurrent misses")
        void shouldShareOneLoad() throws Exception {
            CountDownLatch loaderStarted = new CountDownLatch(1);
            CountDownLatch loaderGate = new CountDownLatch(1);
            AtomicInteger invocations = new AtomicInteger();
            Supplier<String> loader = () -> {
                invocations.incrementAndGet();
                loaderStarted.countDown();
                try {
                    loaderGate.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return VALUE;
            };

            Future<String> first = executor.submit(() -> cache.getOrLoad(KEY, TYPE_REF, null, Set.of(), loader));
            assertThat(loaderStarted.await(2, TimeUnit.SECONDS)).isTrue();
            Future<String> second = executor.submit(() -> cache.getOrLoad(KEY, TYPE_REF, null, Set.of(), loader));

            await().until(() -> cache.getStats().getTotalRequests() == 2);
            Thread.sleep(100);
            loaderGate.countDown();

            assertThat(first.get(2, TimeUnit.SECONDS)).isEqualTo(VALUE);
            assertThat(second.get(2, TimeUnit.SECONDS)).isEqualTo(VALUE);
            assertThat(invocations.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should preserve the interrupted status of a waiting caller")
        void shouldHandleInterruption() throws Exception {
            CountDownLatch loaderStarted = new CountDownLatch(1);
            CountDownLatch loaderGate = new CountDownLatch(1);
            Supplier<String> loader = () -> {
                loaderStarted.countDown();
                try {
                    loaderGate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return VALUE;
            };
            executor.submit(() -> cache.getOrLoad(KEY, TYPE_REF, null, Set.of(), loader));
            assertThat(loaderStarted.await(2, TimeUnit.SECONDS)).isTrue();

            AtomicReference<Throwable> failure = new AtomicReference<>();
            AtomicReference<Boolean> interrupted = new AtomicReference<>();
            Thread waiter = new Thread(() -> {
                try {
                    cache.getOrLoad(KEY, TYPE_REF, null, Set.of(), loader);
                } catch (CacheLoadingException e) {
                    failure.set(e);
                }
                interrupted.set(Thread.currentThread().isInterrupted());
            });
            waiter.start();
            Thread.sleep(100);
            waiter.interrupt();
            waiter.join(2000);
            loaderGate.countDown();

            assertThat(failure.get())
                    .isInstanceOf(CacheLoadingException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(interrupted.get()).isTrue();
        }
    }
}
