package com.pedromossi.clinicache.micrometer;

import static org.assertj.core.api.Assertions.assertThat;

import com.pedromossi.clinicache.local.CaffeineCacheStore;
import com.pedromossi.clinicache.impl.TaggedCacheManager;
import com.pedromossi.clinicache.store.DualCacheStore;
import com.pedromossi.clinicache.trigger.TriggerDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CacheStatsMeterBinder")
class CacheStatsMeterBinderTest {

    private MeterRegistry registry;
    private TaggedCacheManager cache;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        DualCacheStore store = new DualCacheStore(new CaffeineCacheStore("maximumSize=100"), Optional.empty());
        cache = new TaggedCacheManager(store, new TriggerDispatcher(), Duration.ofHours(1));
        new CacheStatsMeterBinder(cache).bindTo(registry);
    }

    @Test
    @DisplayName("should publish the live cache statistics")
    void shouldPublishStatistics() {
        cache.get("a");
        cache.set("a", "v", Set.of("t"));
        cache.set("b", "v", Set.of("t"));
        cache.get("a");
        cache.invalidateByTag("t");

        assertThat(registry.get("clinicache.requests").tag("result", "hit").functionCounter().count()).isEqualTo(1.0);
        assertThat(registry.get("clinicache.requests").tag("result", "miss").functionCounter().count()).isEqualTo(1.0);
        assertThat(registry.get("clinicache.writes").functionCounter().count()).isEqualTo(2.0);
        assertThat(registry.get("clinicache.invalidations").functionCounter().count()).isEqualTo(2.0);
        assertThat(registry.get("clinicache.evictions").functionCounter().count()).isEqualTo(2.0);
        assertThat(registry.get("clinicache.hit.ratio").gauge().value()).isEqualTo(0.5);
        assertThat(registry.get("clinicache.size").gauge().value()).isZero();
        assertThat(registry.get("clinicache.durable.available").gauge().value()).isZero();
    }

    @Test
    @DisplayName("should flag an active batch")
    void shouldFlagBatch() {
        cache.beginBatch();
        assertThat(registry.get("clinicache.batch.active").gauge().value()).isEqualTo(1.0);
        cache.endBatch();
        assertThat(registry.get("clinicache.batch.active").gauge().value()).isZero();
    }
}
