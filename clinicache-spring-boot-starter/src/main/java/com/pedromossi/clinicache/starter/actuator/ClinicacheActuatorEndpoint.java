package com.pedromossi.clinicache.starter.actuator;

import com.pedromossi.clinicache.CacheService;
import com.pedromossi.clinicache.stats.CacheStatsSnapshot;
import com.pedromossi.clinicache.tag.TagInvalidation;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.DeleteOperation;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;

/**
 * Actuator endpoint exposing cache statistics and manual invalidation.
 *
 * <ul>
 *   <li>{@code GET /actuator/clinicache}: statistics snapshot</li>
 *   <li>{@code GET /actuator/clinicache/{key}}: whether a key is cached</li>
 *   <li>{@code DELETE /actuator/clinicache/{tag}}: invalidate a tag</li>
 *   <li>{@code DELETE /actuator/clinicache}: clear everything</li>
 * </ul>
 */
@Endpoint(id = "clinicache")
public class ClinicacheActuatorEndpoint {

    private final CacheService cacheService;

    public ClinicacheActuatorEndpoint(CacheService cacheService) {
        this.cacheService = cacheService;
    }

    @ReadOperation
    public Map<String, Object> getCacheStatus() {
        CacheStatsSnapshot stats = cacheService.getStats();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("totalRequests", stats.getTotalRequests());
        status.put("cacheHits", stats.getCacheHits());
        status.put("cacheMisses", stats.getCacheMisses());
        status.put("hitRatio", stats.getHitRatio());
        status.put("invalidations", stats.getInvalidations());
        status.put("evictions", stats.getEvictions());
        status.put("expirations", stats.getExpirations());
        status.put("writes", stats.getWrites());
        status.put("cacheSize", stats.getCacheSize());
        status.put("tagCount", stats.getTagCount());
        status.put("durableStore", stats.isDurableAvailable() ? "AVAILABLE" : "UNAVAILABLE");
        status.put("batchActive", stats.isBatchActive());
        status.put("deferredTagCount", stats.getDeferredTagCount());

        Map<String, String> actions = new LinkedHashMap<>();
        actions.put("inspectKey", "GET /actuator/clinicache/{key}");
        actions.put("invalidateTag", "DELETE /actuator/clinicache/{tag}");
        actions.put("clearAll", "DELETE /actuator/clinicache");
        status.put("actions", actions);

        return status;
    }

    @ReadOperation
    public Map<String, Object> inspectKey(@Selector String key) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("key", key);
        Object value = cacheService.peek(key);
        if (value != null) {
            details.put("cached", true);
            details.put("valueType", value.getClass().getName());
        } else {
            details.put("cached", false);
        }
        return details;
    }

    @DeleteOperation
    public Map<String, Object> invalidateTag(@Selector String tag) {
        TagInvalidation outcome = cacheService.invalidateTag(tag);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("tag", tag);
        response.put("invalidated", outcome.getRemovedCount());
        response.put("status", outcome.isDeferred() ? "DEFERRED" : "INVALIDATED");
        return response;
    }

    @DeleteOperation
    public Map<String, Object> clearAll() {
        boolean cleared = cacheService.clearAll();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", cleared ? "CLEARED" : "PARTIAL");
        return response;
    }
}
