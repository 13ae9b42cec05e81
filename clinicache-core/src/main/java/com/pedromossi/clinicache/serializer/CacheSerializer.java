package com.pedromossi.clinicache.serializer;

import com.pedromossi.clinicache.CacheEntry;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Codec turning cache entries into bytes for the durable store and back.
 *
 * <p>The encoded form carries the full entry document: key, value, creation and expiry
 * timestamps, tags and version. Implementations decide the wire format.</p>
 *
 * @since 1.0.0
 */
public interface CacheSerializer {

    /**
     * Encodes an entry.
     *
     * @param entry the entry to encode
     * @return the encoded bytes
     * @throws SerializationException if the entry's value cannot be encoded
     */
    byte[] serialize(CacheEntry entry);

    /**
     * Decodes an entry, rebuilding the payload as the requested type.
     *
     * @param data the encoded bytes
     * @param valueType the expected payload type
     * @return the decoded entry
     * @throws SerializationException if the bytes cannot be decoded
     */
    CacheEntry deserialize(byte[] data, ParameterizedTypeReference<?> valueType);
}
