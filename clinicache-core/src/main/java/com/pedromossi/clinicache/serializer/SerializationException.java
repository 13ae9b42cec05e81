package com.pedromossi.clinicache.serializer;

/**
 * Thrown when a cache payload cannot be encoded for, or decoded from, the durable store.
 *
 * <p>A serialization failure only affects the durable copy of an entry. The value stays
 * cached in process.</p>
 *
 * @since 1.0.0
 * @see CacheSerializer
 */
public class SerializationException extends RuntimeException {

    /**
     * Constructs a new serialization exception with the specified detail message and cause.
     *
     * @param message the detail message explaining the serialization failure
     * @param cause the underlying cause of the serialization failure
     */
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
