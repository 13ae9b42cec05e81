package com.pedromossi.clinicache.trigger;

import com.pedromossi.clinicache.CacheService;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry mapping trigger names to the handlers subscribed to them.
 *
 * <p>Handlers are registered at startup and invoked in registration order. A failing
 * handler is logged with the trigger name and context and does not stop the handlers
 * after it. Dispatching a name without handlers logs a warning and does nothing.</p>
 *
 * <p>Registration and dispatch are thread-safe.</p>
 *
 * @since 1.0.0
 */
public class TriggerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TriggerDispatcher.class);

    private final Map<String, List<TriggerHandler>> handlers = new ConcurrentHashMap<>();

    /**
     * Subscribes a handler to a trigger name.
     *
     * @param triggerType the trigger name
     * @param handler the handler
     * @return this dispatcher
     */
    public TriggerDispatcher register(String triggerType, TriggerHandler handler) {
        Objects.requireNonNull(triggerType, "triggerType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.computeIfAbsent(triggerType, type -> new CopyOnWriteArrayList<>()).add(handler);
        log.debug("Registered handler for trigger: {}", triggerType);
        return this;
    }

    public TriggerDispatcher register(InvalidationTrigger trigger, TriggerHandler handler) {
        return register(trigger.triggerName(), handler);
    }

    /**
     * Invokes every handler subscribed to a trigger name.
     *
     * @param triggerType the trigger name
     * @param context the event payload (may be null)
     * @param cache the cache the handlers act on
     * @return the number of handlers that completed without error
     */
    public int dispatch(String triggerType, InvalidationContext context, CacheService cache) {
        List<TriggerHandler> subscribed = triggerType == null ? null : handlers.get(triggerType);
        if (subscribed == null || subscribed.isEmpty()) {
            log.warn("Unknown cache invalidation trigger: {}", triggerType);
            return 0;
        }
        InvalidationContext safeContext = context == null ? InvalidationContext.empty() : context;
        int completed = 0;
        for (TriggerHandler handler : subscribed) {
            try {
                handler.handle(safeContext, cache);
                completed++;
            } catch (RuntimeException e) {
                log.error("Error handling invalidation trigger {} with context {}: {}",
                        triggerType, safeContext, e.getMessage(), e);
            }
        }
        return completed;
    }

    public boolean isRegistered(String triggerType) {
        List<TriggerHandler> subscribed = handlers.get(triggerType);
        return subscribed != null && !subscribed.isEmpty();
    }

    /**
     * @return the trigger names that have at least one handler, sorted
     */
    public Set<String> registeredTriggers() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }
}
