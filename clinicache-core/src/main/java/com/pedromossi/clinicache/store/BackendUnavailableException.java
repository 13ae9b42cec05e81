package com.pedromossi.clinicache.store;

/**
 * Thrown by durable cache stores when the external backend cannot be reached,
 * times out, or is short-circuited.
 *
 * <p>This exception never escapes the cache service: {@link DualCacheStore} catches it,
 * logs it and degrades to the in-process store.</p>
 *
 * @since 1.0.0
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
