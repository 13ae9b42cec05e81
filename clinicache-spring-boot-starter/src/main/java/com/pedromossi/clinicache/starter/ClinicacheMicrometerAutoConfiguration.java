package com.pedromossi.clinicache.starter;

import com.pedromossi.clinicache.CacheService;
import com.pedromossi.clinicache.micrometer.CacheStatsMeterBinder;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration with the clinic cache.
 * This configuration is separated from the main ClinicacheAutoConfiguration so applications
 * without Micrometer on the classpath never load it.
 *
 * <p>Any {@link MeterRegistry} in the context picks up the binder automatically, which
 * publishes the cache counters and gauges under the {@code clinicache.*} names.</p>
 */
@AutoConfiguration(after = ClinicacheAutoConfiguration.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(CacheService.class)
public class ClinicacheMicrometerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ClinicacheMicrometerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CacheStatsMeterBinder cacheStatsMeterBinder(CacheService cacheService) {
        log.info("Publishing clinic cache statistics to Micrometer under 'clinicache.*'");
        return new CacheStatsMeterBinder(cacheService);
    }
}
