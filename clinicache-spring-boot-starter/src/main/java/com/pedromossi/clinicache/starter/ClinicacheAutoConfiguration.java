package com.pedromossi.clinicache.starter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pedromossi.clinicache.CacheService;
import com.pedromossi.clinicache.CacheStore;
import com.pedromossi.clinicache.CacheWarmer;
import com.pedromossi.clinicache.aspect.CacheAspect;
import com.pedromossi.clinicache.clinic.ClinicCacheAccessors;
import com.pedromossi.clinicache.clinic.ClinicCacheWarmer;
import com.pedromossi.clinicache.clinic.ClinicDataSource;
import com.pedromossi.clinicache.clinic.ClinicInvalidationEvents;
import com.pedromossi.clinicache.clinic.ClinicInvalidationHandlers;
import com.pedromossi.clinicache.impl.TaggedCacheManager;
import com.pedromossi.clinicache.local.CaffeineCacheStore;
import com.pedromossi.clinicache.micrometer.MetricsCollectingCacheStore;
import com.pedromossi.clinicache.redis.RedisCacheStore;
import com.pedromossi.clinicache.redis.serializer.JacksonCacheSerializer;
import com.pedromossi.clinicache.resilience.CircuitBreakerCacheStore;
import com.pedromossi.clinicache.serializer.CacheSerializer;
import com.pedromossi.clinicache.serializer.SerializationException;
import com.pedromossi.clinicache.starter.actuator.ClinicacheActuatorEndpoint;
import com.pedromossi.clinicache.store.DualCacheStore;
import com.pedromossi.clinicache.trigger.TriggerDispatcher;
import com.pedromossi.clinicache.trigger.TriggerDispatcherCustomizer;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Spring Boot auto-configuration for the clinic cache.
 *
 * <p>This auto-configuration class sets up the tag-indexed cache with an optional
 * Redis-backed durable store. It is activated by default and can be disabled with
 * {@code clinicache.enabled=false}.</p>
 *
 * <p><strong>Configured Components:</strong></p>
 * <ul>
 *   <li><strong>In-process store:</strong> Caffeine, always present</li>
 *   <li><strong>Durable store:</strong> Redis, when {@code clinicache.durable.url} is set,
 *       with bounded connect and command timeouts, metrics and a circuit breaker</li>
 *   <li><strong>Cache service:</strong> {@link TaggedCacheManager} with the built-in
 *       trigger handlers plus any {@link TriggerDispatcherCustomizer} beans</li>
 *   <li><strong>AOP:</strong> {@link CacheAspect} for {@code @CachedQuery} and
 *       {@code @TriggersInvalidation}</li>
 *   <li><strong>Clinic accessors:</strong> when the application provides a
 *       {@link ClinicDataSource}</li>
 *   <li><strong>Maintenance:</strong> startup warm-up and periodic purge of expired entries</li>
 * </ul>
 *
 * <p>All beans are conditional and can be overridden by user-defined beans.</p>
 *
 * @since 1.0.0
 * @see ClinicacheProperties
 */
@AutoConfiguration
@EnableConfigurationProperties(ClinicacheProperties.class)
@ConditionalOnProperty(name = "clinicache.enabled", havingValue = "true", matchIfMissing = true)
public class ClinicacheAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ClinicacheAutoConfiguration.class);

    @Bean("clinicacheClock")
    @ConditionalOnMissingBean(name = "clinicacheClock")
    public Clock clinicacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CaffeineCacheStore localCacheStore(ClinicacheProperties properties) {
        return new CaffeineCacheStore(properties.getLocal().getSpec());
    }

    @Bean
    @ConditionalOnMissingBean
    public DualCacheStore dualCacheStore(
            CaffeineCacheStore localCacheStore,
            @Qualifier("durableCacheStore") Optional<CacheStore> durableCacheStore) {
        return new DualCacheStore(localCacheStore, durableCacheStore);
    }

    /**
     * Creates the trigger registry with the built-in clinic handlers, then lets every
     * {@link TriggerDispatcherCustomizer} bean add its own.
     */
    @Bean
    @ConditionalOnMissingBean
    public TriggerDispatcher triggerDispatcher(ObjectProvider<TriggerDispatcherCustomizer> customizers) {
        TriggerDispatcher dispatcher = ClinicInvalidationHandlers.newDispatcher();
        customizers.orderedStream().forEach(customizer -> customizer.customize(dispatcher));
        return dispatcher;
    }

    @Bean
    @ConditionalOnMissingBean(CacheService.class)
    public TaggedCacheManager cacheService(
            DualCacheStore dualCacheStore,
            TriggerDispatcher triggerDispatcher,
            ClinicacheProperties properties,
            @Qualifier("clinicacheClock") Clock clock) {
        return new TaggedCacheManager(dualCacheStore, triggerDispatcher, properties.getDefaultTtl(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheAspect cacheAspect(CacheService cacheService) {
        return new CacheAspect(cacheService);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClinicInvalidationEvents clinicInvalidationEvents(CacheService cacheService) {
        return new ClinicInvalidationEvents(cacheService);
    }

    /**
     * Runs every {@link CacheWarmer} once the application has started, before it is
     * reported ready. Warm-up failures are logged and never abort startup.
     */
    @Bean
    @ConditionalOnProperty(name = "clinicache.warmup.enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner clinicacheWarmupRunner(ObjectProvider<CacheWarmer> warmers) {
        return args -> warmers.orderedStream().forEach(warmer -> {
            try {
                Map<String, Boolean> results = warmer.warm();
                log.info("Cache warmer {} finished: {}", warmer.getClass().getSimpleName(), results);
            } catch (RuntimeException e) {
                log.error("Cache warmer {} failed: {}", warmer.getClass().getSimpleName(), e.getMessage(), e);
            }
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpiredEntryPurger expiredEntryPurger(CacheService cacheService, ClinicacheProperties properties) {
        return new ExpiredEntryPurger(cacheService, properties.getPurgeInterval());
    }

    @Configuration
    @ConditionalOnClass(Endpoint.class)
    protected static class ActuatorConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ClinicacheActuatorEndpoint clinicacheActuatorEndpoint(CacheService cacheService) {
            return new ClinicacheActuatorEndpoint(cacheService);
        }
    }

    /**
     * Read-through accessors, available when the application exposes its clinic data.
     */
    @Configuration
    @ConditionalOnBean(ClinicDataSource.class)
    protected static class ClinicAccessorsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ClinicCacheAccessors clinicCacheAccessors(CacheService cacheService, ClinicDataSource clinicDataSource) {
            return new ClinicCacheAccessors(cacheService, clinicDataSource);
        }

        @Bean
        @ConditionalOnMissingBean
        public ClinicCacheWarmer clinicCacheWarmer(ClinicCacheAccessors clinicCacheAccessors) {
            return new ClinicCacheWarmer(clinicCacheAccessors);
        }
    }

    /**
     * Configuration for the Redis-backed durable store.
     *
     * <p>This nested configuration is active when {@code clinicache.durable.url} is set.
     * Without it the cache runs in process only.</p>
     */
    @Configuration
    @ConditionalOnClass(RedisTemplate.class)
    @ConditionalOnProperty(prefix = "clinicache.durable", name = "url")
    protected static class DurableStoreConfiguration {

        /**
         * Connection factory dedicated to the cache. It is not a default injection candidate,
         * so it never competes with the application's own Redis connection.
         */
        @Bean(name = "clinicacheRedisConnectionFactory", defaultCandidate = false)
        @ConditionalOnMissingBean(name = "clinicacheRedisConnectionFactory")
        public LettuceConnectionFactory clinicacheRedisConnectionFactory(ClinicacheProperties properties) {
            ClinicacheProperties.DurableStoreProperties durable = properties.getDurable();
            RedisURI uri = RedisURI.create(durable.getUrl());

            RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
            server.setDatabase(uri.getDatabase());
            if (uri.getUsername() != null) {
                server.setUsername(uri.getUsername());
            }
            if (uri.getPassword() != null) {
                server.setPassword(RedisPassword.of(uri.getPassword()));
            }

            LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                    .commandTimeout(durable.getReadTimeout())
                    .clientOptions(ClientOptions.builder()
                            .socketOptions(SocketOptions.builder().connectTimeout(durable.getConnectTimeout()).build())
                            .build());
            if (uri.isSsl()) {
                client.useSsl();
            }
            log.info("Durable cache store configured for Redis at {}:{} (database {})",
                    uri.getHost(), uri.getPort(), uri.getDatabase());
            return new LettuceConnectionFactory(server, client.build());
        }

        @Bean("cachingObjectMapper")
        @ConditionalOnMissingBean(name = "cachingObjectMapper")
        public ObjectMapper cachingObjectMapper() {
            return new ObjectMapper()
                    .registerModule(new Jdk8Module())
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }

        @Bean
        @ConditionalOnMissingBean
        public CacheSerializer cacheSerializer(@Qualifier("cachingObjectMapper") ObjectMapper objectMapper) {
            log.info("No custom CacheSerializer bean found. Creating default JacksonCacheSerializer.");
            return new JacksonCacheSerializer(objectMapper);
        }

        @Bean("clinicacheRedisTemplate")
        @ConditionalOnMissingBean(name = "clinicacheRedisTemplate")
        public RedisTemplate<String, byte[]> clinicacheRedisTemplate(
                @Qualifier("clinicacheRedisConnectionFactory") RedisConnectionFactory connectionFactory) {
            RedisTemplate<String, byte[]> template = new RedisTemplate<>();
            template.setConnectionFactory(connectionFactory);
            template.setKeySerializer(new StringRedisSerializer());
            template.setValueSerializer(RedisSerializer.byteArray());
            template.afterPropertiesSet();
            return template;
        }

        /**
         * Creates the durable store, pings Redis once, and wraps the store with metrics
         * (when a {@link MeterRegistry} exists) and a circuit breaker (unless disabled).
         */
        @Bean("durableCacheStore")
        public CacheStore durableCacheStore(
                @Qualifier("clinicacheRedisTemplate") RedisTemplate<String, byte[]> redisTemplate,
                ClinicacheProperties properties,
                CacheSerializer serializer,
                Optional<MeterRegistry> meterRegistry,
                Optional<CircuitBreakerRegistry> circuitBreakerRegistry) {

            RedisCacheStore redisStore = new RedisCacheStore(redisTemplate, properties.getDurable().getKeyPrefix(), serializer);
            redisStore.ping();
            CacheStore store = redisStore;

            if (meterRegistry.isPresent()) {
                log.info("MeterRegistry found. Enabling metrics for the durable cache store.");
                store = new MetricsCollectingCacheStore(store, meterRegistry.get(), "durable");
            }

            ClinicacheProperties.CircuitBreakerProperties cbProps = properties.getDurable().getCircuitBreaker();
            if (cbProps.isEnabled()) {
                CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                        .failureRateThreshold(cbProps.getFailureRateThreshold())
                        .minimumNumberOfCalls(cbProps.getMinimumNumberOfCalls())
                        .slidingWindowSize(cbProps.getSlidingWindowSize())
                        .slowCallRateThreshold(cbProps.getSlowCallRateThreshold())
                        .slowCallDurationThreshold(cbProps.getSlowCallDurationThreshold())
                        .permittedNumberOfCallsInHalfOpenState(cbProps.getPermittedNumberOfCallsInHalfOpenState())
                        .waitDurationInOpenState(cbProps.getWaitDurationInOpenState())
                        .ignoreExceptions(SerializationException.class)
                        .build();
                CircuitBreaker circuitBreaker = circuitBreakerRegistry
                        .map(registry -> registry.circuitBreaker("clinicacheDurableStore", config))
                        .orElseGet(() -> CircuitBreaker.of("clinicacheDurableStore", config));
                store = new CircuitBreakerCacheStore(store, circuitBreaker);
                log.info("Circuit breaker enabled for the durable cache store.");
            }
            return store;
        }
    }

    /**
     * Periodically removes expired entries from the in-process store.
     *
     * <p>Expired entries are already invisible to readers. The sweep only reclaims
     * memory held by keys that are never read again.</p>
     */
    public static class ExpiredEntryPurger implements InitializingBean, DisposableBean {

        private static final Logger log = LoggerFactory.getLogger(ExpiredEntryPurger.class);

        private final CacheService cacheService;
        private final Duration interval;
        private ThreadPoolTaskScheduler scheduler;
        private ScheduledFuture<?> task;

        public ExpiredEntryPurger(CacheService cacheService, Duration interval) {
            this.cacheService = cacheService;
            this.interval = interval;
        }

        @Override
        public void afterPropertiesSet() {
            if (interval == null || interval.isZero() || interval.isNegative()) {
                log.info("Expired cache entry purge is disabled");
                return;
            }
            scheduler = new ThreadPoolTaskScheduler();
            scheduler.setPoolSize(1);
            scheduler.setThreadNamePrefix("clinicache-purge-");
            scheduler.setDaemon(true);
            scheduler.initialize();
            task = scheduler.scheduleWithFixedDelay(this::purge, interval);
            log.info("Expired cache entries will be purged every {}", interval);
        }

        /**
         * Runs one sweep.
         *
         * @return the number of entries purged, 0 if the sweep failed
         */
        public int purge() {
            try {
                return cacheService.purgeExpired();
            } catch (RuntimeException e) {
                log.error("Error purging expired cache entries: {}", e.getMessage(), e);
                return 0;
            }
        }

        public boolean isScheduled() {
            return task != null && !task.isCancelled();
        }

        @Override
        public void destroy() {
            if (task != null) {
                task.cancel(false);
            }
            if (scheduler != null) {
                scheduler.shutdown();
            }
        }
    }
}
