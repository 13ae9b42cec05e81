package com.pedromossi.clinicache.starter;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the clinic cache.
 * Allows configuration via application.yml or application.properties.
 *
 * <pre>{@code
 * clinicache:
 *   default-ttl: 1h
 *   local:
 *     spec: maximumSize=10000
 *   durable:
 *     url: redis://cache.internal:6379/0
 *     connect-timeout: 2s
 *     read-timeout: 2s
 *   warmup:
 *     enabled: true
 *   purge-interval: 5m
 * }</pre>
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "clinicache")
public class ClinicacheProperties {

    /**
     * Enables or disables the clinic cache globally.
     */
    private boolean enabled = true;

    /**
     * Time to live for writes that do not specify one.
     */
    private Duration defaultTtl = Duration.ofHours(1);

    /**
     * How often expired in-process entries are swept. Zero disables the sweep.
     */
    private Duration purgeInterval = Duration.ofMinutes(5);

    private LocalStoreProperties local = new LocalStoreProperties();
    private DurableStoreProperties durable = new DurableStoreProperties();
    private WarmupProperties warmup = new WarmupProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Duration getPurgeInterval() {
        return purgeInterval;
    }

    public void setPurgeInterval(Duration purgeInterval) {
        this.purgeInterval = purgeInterval;
    }

    public LocalStoreProperties getLocal() {
        return local;
    }

    public void setLocal(LocalStoreProperties local) {
        this.local = local;
    }

    public DurableStoreProperties getDurable() {
        return durable;
    }

    public void setDurable(DurableStoreProperties durable) {
        this.durable = durable;
    }

    public WarmupProperties getWarmup() {
        return warmup;
    }

    public void setWarmup(WarmupProperties warmup) {
        this.warmup = warmup;
    }

    /**
     * Configuration properties for the in-process (Caffeine) store.
     */
    public static class LocalStoreProperties {

        /**
         * Caffeine specification of the in-process store.
         */
        private String spec = "maximumSize=10000";

        public String getSpec() {
            return spec;
        }

        public void setSpec(String spec) {
            this.spec = spec;
        }
    }

    /**
     * Configuration properties for the durable (Redis) store.
     */
    public static class DurableStoreProperties {

        /**
         * Redis URL, e.g. redis://:secret@localhost:6379/0. Leave unset to run in process only.
         */
        private String url;

        /**
         * Namespace prepended to every Redis key.
         */
        private String keyPrefix = "clinicache:";

        private Duration connectTimeout = Duration.ofSeconds(2);

        /**
         * Maximum time to wait for a Redis command.
         */
        private Duration readTimeout = Duration.ofSeconds(2);

        private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public CircuitBreakerProperties getCircuitBreaker() {
            return circuitBreaker;
        }

        public void setCircuitBreaker(CircuitBreakerProperties circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
        }
    }

    /**
     * Configuration properties for the circuit breaker guarding the durable store.
     */
    public static class CircuitBreakerProperties {
        private boolean enabled = true;
        private float failureRateThreshold = 50.0f;
        private int minimumNumberOfCalls = 10;
        private int slidingWindowSize = 20;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(1);
        private float slowCallRateThreshold = 100.0f;
        private int permittedNumberOfCallsInHalfOpenState = 5;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public float getFailureRateThreshold() {
            return failureRateThreshold;
        }

        public void setFailureRateThreshold(float failureRateThreshold) {
            this.failureRateThreshold = failureRateThreshold;
        }

        public int getMinimumNumberOfCalls() {
            return minimumNumberOfCalls;
        }

        public void setMinimumNumberOfCalls(int minimumNumberOfCalls) {
            this.minimumNumberOfCalls = minimumNumberOfCalls;
        }

        public int getSlidingWindowSize() {
            return slidingWindowSize;
        }

        public void setSlidingWindowSize(int slidingWindowSize) {
            this.slidingWindowSize = slidingWindowSize;
        }

        public Duration getSlowCallDurationThreshold() {
            return slowCallDurationThreshold;
        }

        public void setSlowCallDurationThreshold(Duration slowCallDurationThreshold) {
            this.slowCallDurationThreshold = slowCallDurationThreshold;
        }

        public float getSlowCallRateThreshold() {
            return slowCallRateThreshold;
        }

        public void setSlowCallRateThreshold(float slowCallRateThreshold) {
            this.slowCallRateThreshold = slowCallRateThreshold;
        }

        public int getPermittedNumberOfCallsInHalfOpenState() {
            return permittedNumberOfCallsInHalfOpenState;
        }

        public void setPermittedNumberOfCallsInHalfOpenState(int calls) {
            this.permittedNumberOfCallsInHalfOpenState = calls;
        }

        public Duration getWaitDurationInOpenState() {
            return waitDurationInOpenState;
        }

        public void setWaitDurationInOpenState(Duration waitDuration) {
            this.waitDurationInOpenState = waitDuration;
        }
    }

    /**
     * Configuration properties for startup cache warming.
     */
    public static class WarmupProperties {

        /**
         * Runs every CacheWarmer bean once the application has started.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
