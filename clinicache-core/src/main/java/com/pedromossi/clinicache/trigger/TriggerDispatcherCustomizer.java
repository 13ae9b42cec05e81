package com.pedromossi.clinicache.trigger;

/**
 * Callback for registering additional trigger handlers at startup.
 *
 * <p>Declare beans of this type to subscribe application-specific handlers next to the
 * built-in ones.</p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TriggerDispatcherCustomizer {

    void customize(TriggerDispatcher dispatcher);
}
