package com.pedromossi.clinicache.resilience;

import com.pedromossi.clinicache.CacheEntry;
import com.pedromossi.clinicache.CacheStore;
import com.pedromossi.clinicache.store.BackendUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Decorator that guards a durable {@link CacheStore} with a Resilience4j circuit breaker.
 *
 * <p>Once the breaker opens, calls fail immediately with a {@link BackendUnavailableException}
 * instead of waiting for the backend's timeout, so each cache operation falls back to the
 * in-process store without delay. While the breaker is open the store reports itself as
 * unavailable.</p>
 *
 * <p>Which exceptions count as failures is decided by the breaker's configuration.
 * Codec errors should be ignored there, as they say nothing about backend health.</p>
 *
 * @since 1.0.0
 * @see CircuitBreaker
 */
public class CircuitBreakerCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerCacheStore.class);

    private final CacheStore delegate;
    private final CircuitBreaker circuitBreaker;

    /**
     * @param delegate the durable store to guard
     * @param circuitBreaker the configured breaker instance
     */
    public CircuitBreakerCacheStore(CacheStore delegate, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Durable cache circuit breaker state changed: {}", event));
    }

    @Override
    public CacheEntry get(String key, ParameterizedTypeReference<?> valueType) {
        return execute(() -> delegate.get(key, valueType));
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        execute(() -> {
            delegate.put(entry, ttl);
            return null;
        });
    }

    @Override
    public boolean evict(String key) {
        return execute(() -> delegate.evict(key));
    }

    @Override
    public void clear() {
        execute(() -> {
            delegate.clear();
            return null;
        });
    }

    @Override
    public boolean isAvailable() {
        CircuitBreaker.State state = circuitBreaker.getState();
        return state != CircuitBreaker.State.OPEN && state != CircuitBreaker.State.FORCED_OPEN && delegate.isAvailable();
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private <T> T execute(Supplier<T> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            throw new BackendUnavailableException("Durable cache circuit breaker is open", e);
        }
    }
}
