package com.pedromossi.clinicache.micrometer;

import com.pedromossi.clinicache.CacheEntry;
import com.pedromossi.clinicache.CacheStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Decorator that records Micrometer metrics for every call to a {@link CacheStore}.
 *
 * <p><strong>Metrics:</strong></p>
 * <ul>
 * <li>{@code clinicache.store.latency}: timer per operation and key prefix</li>
 * <li>{@code clinicache.store.operations.total}: read outcomes, tagged {@code result=hit|miss}</li>
 * <li>{@code clinicache.store.errors.total}: failures per operation and exception type</li>
 * </ul>
 *
 * <p>Every meter carries a {@code store} tag naming the decorated store. The key prefix
 * is the part of the key before the first colon, e.g. {@code patient_demographics}.</p>
 *
 * <p>Exceptions are recorded and rethrown unchanged.</p>
 *
 * @since 1.0.0
 */
public class MetricsCollectingCacheStore implements CacheStore {

    private static final String METRIC_LATENCY = "clinicache.store.latency";
    private static final String METRIC_OPERATIONS = "clinicache.store.operations.total";
    private static final String METRIC_ERRORS = "clinicache.store.errors.total";
    private static final String ALL_KEYS_PREFIX = "all";

    private final CacheStore delegate;
    private final MeterRegistry meterRegistry;
    private final Tags commonTags;

    /**
     * @param delegate the store to measure
     * @param meterRegistry where meters are registered
     * @param storeName value of the {@code store} tag, e.g. "durable"
     */
    public MetricsCollectingCacheStore(CacheStore delegate, MeterRegistry meterRegistry, String storeName) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;
        this.commonTags = Tags.of("store", storeName);
    }

    @Override
    public CacheEntry get(String key, ParameterizedTypeReference<?> valueType) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String keyPrefix = extractKeyPrefix(key);
        try {
            CacheEntry entry = delegate.get(key, valueType);

            Tag resultTag = entry != null ? Tag.of("result", "hit") : Tag.of("result", "miss");
            Counter.builder(METRIC_OPERATIONS)
                    .tags(commonTags.and(resultTag))
                    .register(meterRegistry)
                    .increment();

            sample.stop(latencyTimer("get", keyPrefix));
            return entry;
        } catch (RuntimeException e) {
            recordFailure(sample, "get", keyPrefix, e);
            throw e;
        }
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String keyPrefix = extractKeyPrefix(entry.getKey());
        try {
            delegate.put(entry, ttl);
            sample.stop(latencyTimer("put", keyPrefix));
        } catch (RuntimeException e) {
            recordFailure(sample, "put", keyPrefix, e);
            throw e;
        }
    }

    @Override
    public boolean evict(String key) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String keyPrefix = extractKeyPrefix(key);
        try {
            boolean removed = delegate.evict(key);
            sample.stop(latencyTimer("evict", keyPrefix));
            return removed;
        } catch (RuntimeException e) {
            recordFailure(sample, "evict", keyPrefix, e);
            throw e;
        }
    }

    @Override
    public void clear() {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            delegate.clear();
            sample.stop(latencyTimer("clear", ALL_KEYS_PREFIX));
        } catch (RuntimeException e) {
            recordFailure(sample, "clear", ALL_KEYS_PREFIX, e);
            throw e;
        }
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    private Timer latencyTimer(String operation, String keyPrefix) {
        return Timer.builder(METRIC_LATENCY)
                .tags(commonTags)
                .tags("operation", operation, "key.prefix", keyPrefix)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    private void recordFailure(Timer.Sample sample, String operation, String keyPrefix, Exception e) {
        sample.stop(latencyTimer(operation, keyPrefix));

        Counter.builder(METRIC_ERRORS)
                .tags(commonTags)
                .tags("operation", operation, "key.prefix", keyPrefix, "exception.type", e.getClass().getSimpleName())
                .register(meterRegistry)
                .increment();
    }

    private String extractKeyPrefix(String key) {
        if (key == null) {
            return "unknown";
        }
        int firstColon = key.indexOf(':');
        return firstColon == -1 ? key : key.substring(0, firstColon);
    }
}
