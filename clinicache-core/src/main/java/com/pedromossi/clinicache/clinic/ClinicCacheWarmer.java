package com.pedromossi.clinicache.clinic;

import com.pedromossi.clinicache.CacheWarmer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Warms the reference data every page needs: active and all screening types, and
 * document types. A failure to load one item is logged and does not stop the others.
 */
public class ClinicCacheWarmer implements CacheWarmer {

    private static final Logger log = LoggerFactory.getLogger(ClinicCacheWarmer.class);

    private final ClinicCacheAccessors accessors;

    public ClinicCacheWarmer(ClinicCacheAccessors accessors) {
        this.accessors = accessors;
    }

    @Override
    public Map<String, Boolean> warm() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        results.put("active_screening_types", warmItem("active screening types", () -> accessors.screeningTypes(true)));
        results.put("all_screening_types", warmItem("all screening types", () -> accessors.screeningTypes(false)));
        results.put("document_types", warmItem("document types", accessors::documentTypes));
        long warmed = results.values().stream().filter(Boolean::booleanValue).count();
        log.info("Cache warming completed: {}/{} items loaded", warmed, results.size());
        return results;
    }

    private boolean warmItem(String description, Runnable loader) {
        try {
            loader.run();
            log.debug("Warmed cache with {}", description);
            return true;
        } catch (RuntimeException e) {
            log.error("Error warming cache with {}: {}", description, e.getMessage(), e);
            return false;
        }
    }
}
