package com.pedromossi.clinicache.impl;

/**
 * Thrown when a memoized loader fails with a checked exception or is interrupted
 * while waiting for a concurrent load of the same key.
 *
 * @since 1.0.0
 */
public class CacheLoadingException extends RuntimeException {

    public CacheLoadingException(String message) {
        super(message);
    }

    public CacheLoadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
