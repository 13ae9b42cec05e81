package com.pedromossi.clinicache;

import java.util.Map;

/**
 * Pre-populates the cache before the application starts serving traffic.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CacheWarmer {

    /**
     * Loads frequently requested data into the cache.
     *
     * @return per warmed item, whether it was loaded successfully
     */
    Map<String, Boolean> warm();
}
