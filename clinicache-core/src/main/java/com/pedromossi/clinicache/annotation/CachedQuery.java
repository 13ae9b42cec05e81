package com.pedromossi.clinicache.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Caches a method's result under a SpEL-computed key, with a time to live and tags.
 *
 * <p>On a hit the method is not invoked. On a miss it is invoked once, even under
 * concurrent calls with the same key, and a non-null result is cached. {@code null}
 * results are returned but never cached.</p>
 *
 * <pre>{@code
 * @CachedQuery(key = "'screening_summary:' + #patientId",
 *              ttlSeconds = 1800,
 *              tags = {"'patient_' + #patientId", "'patient_screening_summaries'"})
 * public ScreeningSummary screeningSummary(long patientId) {
 *     return summaryRepository.load(patientId);
 * }
 * }</pre>
 *
 * <p>Key and tag expressions see the method parameters by name ({@code #patientId}) or by
 * position ({@code #a0}, {@code #p0}). String literals need single quotes.</p>
 *
 * <p><strong>AOP requirements:</strong> the method must be public, called through a Spring
 * proxy (not from inside the same class), and declared on a Spring-managed bean.</p>
 *
 * @since 1.0.0
 * @see com.pedromossi.clinicache.aspect.CacheAspect
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CachedQuery {

    /**
     * SpEL expression producing the cache key.
     */
    String key();

    /**
     * Time to live in seconds. Zero or negative uses the cache's default TTL.
     */
    long ttlSeconds() default 0;

    /**
     * SpEL expressions producing the tags of the cached result.
     */
    String[] tags() default {};
}
