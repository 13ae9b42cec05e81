package com.pedromossi.clinicache.micrometer;

import com.pedromossi.clinicache.CacheService;
import com.pedromossi.clinicache.stats.CacheStatsSnapshot;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.function.ToDoubleFunction;

/**
 * Publishes the cache service's statistics as Micrometer meters.
 *
 * <p>Counters: {@code clinicache.requests} (tagged {@code result=hit|miss}),
 * {@code clinicache.invalidations}, {@code clinicache.evictions}, {@code clinicache.expirations},
 * {@code clinicache.writes}. Gauges: {@code clinicache.size}, {@code clinicache.hit.ratio},
 * {@code clinicache.tags}, {@code clinicache.durable.available}, {@code clinicache.batch.active}.</p>
 *
 * @since 1.0.0
 */
public class CacheStatsMeterBinder implements MeterBinder {

    private final CacheService cacheService;

    public CacheStatsMeterBinder(CacheService cacheService) {
        this.cacheService = cacheService;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        counter(registry, "clinicache.requests", "Cache reads that found a live entry", s -> s.getCacheHits(), "hit");
        counter(registry, "clinicache.requests", "Cache reads that found nothing", s -> s.getCacheMisses(), "miss");
        counter(registry, "clinicache.invalidations", "Entries removed by tag invalidation", s -> s.getInvalidations(), null);
        counter(registry, "clinicache.evictions", "Entries deleted", s -> s.getEvictions(), null);
        counter(registry, "clinicache.expirations", "Entries dropped after their TTL", s -> s.getExpirations(), null);
        counter(registry, "clinicache.writes", "Successful cache writes", s -> s.getWrites(), null);

        gauge(registry, "clinicache.size", "Entries held in process", s -> s.getCacheSize());
        gauge(registry, "clinicache.hit.ratio", "Hits per request", CacheStatsSnapshot::getHitRatio);
        gauge(registry, "clinicache.tags", "Indexed tags", s -> s.getTagCount());
        gauge(registry, "clinicache.durable.available", "1 if the durable store is reachable",
                s -> s.isDurableAvailable() ? 1 : 0);
        gauge(registry, "clinicache.batch.active", "1 while a batch operation defers invalidations",
                s -> s.isBatchActive() ? 1 : 0);
    }

    private void counter(MeterRegistry registry, String name, String description,
                         ToDoubleFunction<CacheStatsSnapshot> value, String result) {
        FunctionCounter.Builder<CacheService> builder = FunctionCounter
                .builder(name, cacheService, service -> value.applyAsDouble(service.getStats()))
                .description(description);
        if (result != null) {
            builder.tag("result", result);
        }
        builder.register(registry);
    }

    private void gauge(MeterRegistry registry, String name, String description,
                       ToDoubleFunction<CacheStatsSnapshot> value) {
        Gauge.builder(name, cacheService, service -> value.applyAsDouble(service.getStats()))
                .description(description)
                .register(registry);
    }
}
