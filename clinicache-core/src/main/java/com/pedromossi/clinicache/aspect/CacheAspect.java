package com.pedromossi.clinicache.aspect;

import com.pedromossi.clinicache.CacheService;
import com.pedromossi.clinicache.annotation.CachedQuery;
import com.pedromossi.clinicache.annotation.TriggersInvalidation;
import com.pedromossi.clinicache.impl.CacheLoadingException;
import com.pedromossi.clinicache.trigger.InvalidationContext;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.expression.MethodBasedEvaluationContext;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.util.ClassUtils;

/**
 * Applies {@link CachedQuery} and {@link TriggersInvalidation} to Spring beans.
 *
 * <p>{@code @CachedQuery} methods are routed through
 * {@link CacheService#getOrLoad}, using the method's generic return type so that the
 * durable store decodes results back into the declared type.</p>
 *
 * <p>{@code @TriggersInvalidation} methods run first. The trigger fires only after they
 * return normally.</p>
 *
 * <p>Exceptions thrown by the intercepted method reach the caller unchanged.</p>
 *
 * @since 1.0.0
 */
@Aspect
public class CacheAspect {

    private static final Logger log = LoggerFactory.getLogger(CacheAspect.class);

    private final CacheService cacheService;

    private final ExpressionParser parser = new SpelExpressionParser();

    private final ParameterNameDiscoverer parameterNameDiscoverer = new DefaultParameterNameDiscoverer();

    public CacheAspect(CacheService cacheService) {
        this.cacheService = cacheService;
    }

    @Around("@annotation(cachedQuery)")
    public Object handleCachedQuery(ProceedingJoinPoint joinPoint, CachedQuery cachedQuery) throws Throwable {
        StandardEvaluationContext context = evaluationContext(joinPoint);
        String key = parser.parseExpression(cachedQuery.key()).getValue(context, String.class);
        if (key == null) {
            throw new IllegalArgumentException("@CachedQuery key expression '" + cachedQuery.key()
                    + "' evaluated to null on " + joinPoint.getSignature().toShortString());
        }
        Set<String> tags = new LinkedHashSet<>();
        for (String tagExpression : cachedQuery.tags()) {
            String tag = parser.parseExpression(tagExpression).getValue(context, String.class);
            if (tag != null) {
                tags.add(tag);
            }
        }
        Duration ttl = cachedQuery.ttlSeconds() > 0 ? Duration.ofSeconds(cachedQuery.ttlSeconds()) : null;

        log.debug("@CachedQuery intercepted method: {} with key: {} and tags: {}",
                joinPoint.getSignature().getName(), key, tags);

        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        Type returnType = method.getGenericReturnType();
        if (returnType instanceof Class<?> returnClass) {
            returnType = ClassUtils.resolvePrimitiveIfNecessary(returnClass);
        }
        ParameterizedTypeReference<Object> typeRef = ParameterizedTypeReference.forType(returnType);
        try {
            return cacheService.getOrLoad(key, typeRef, ttl, tags, () -> proceed(joinPoint, key));
        } catch (CacheLoadingException e) {
            throw e.getCause() != null ? e.getCause() : e;
        }
    }

    @Around("@annotation(triggersInvalidation)")
    public Object handleTriggersInvalidation(ProceedingJoinPoint joinPoint, TriggersInvalidation triggersInvalidation)
            throws Throwable {
        Object result = joinPoint.proceed();

        StandardEvaluationContext context = evaluationContext(joinPoint);
        Map<String, Object> values = new LinkedHashMap<>();
        for (String entry : triggersInvalidation.context()) {
            int separator = entry.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("@TriggersInvalidation context entry '" + entry
                        + "' must have the form name=expression");
            }
            String name = entry.substring(0, separator).trim();
            Object value = parser.parseExpression(entry.substring(separator + 1)).getValue(context);
            values.put(name, value);
        }
        log.debug("@TriggersInvalidation firing {} after {} with context {}",
                triggersInvalidation.value(), joinPoint.getSignature().getName(), values);
        cacheService.triggerInvalidation(triggersInvalidation.value(), InvalidationContext.of(values));
        return result;
    }

    private Object proceed(ProceedingJoinPoint joinPoint, String key) {
        try {
            return joinPoint.proceed();
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable e) {
            throw new CacheLoadingException("Error executing loader for cache key: " + key, e);
        }
    }

    private StandardEvaluationContext evaluationContext(ProceedingJoinPoint joinPoint) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        return new MethodBasedEvaluationContext(joinPoint.getTarget(), method, joinPoint.getArgs(), parameterNameDiscoverer);
    }
}
