package com.pedromossi.clinicache.trigger;

import com.pedromossi.clinicache.CacheService;

/**
 * Reacts to a named invalidation trigger, typically by invalidating one or more tags.
 *
 * @since 1.0.0
 * @see TriggerDispatcher
 */
@FunctionalInterface
public interface TriggerHandler {

    /**
     * Handles one trigger occurrence.
     *
     * @param context the event payload
     * @param cache the cache the trigger was fired on
     */
    void handle(InvalidationContext context, CacheService cache);
}
