package com.pedromossi.clinicache.redis.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pedromossi.clinicache.CacheEntry;
import com.pedromossi.clinicache.serializer.CacheSerializer;
import com.pedromossi.clinicache.serializer.SerializationException;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Jackson-based {@link CacheSerializer} storing each entry as a JSON document.
 *
 * <pre>{@code
 * {
 *   "key": "patient_demographics:42",
 *   "value": { ... },
 *   "createdAt": "2024-05-01T10:15:30Z",
 *   "expiresAt": "2024-05-01T11:15:30Z",
 *   "tags": ["patient_demographics", "patient_42"],
 *   "version": 7
 * }
 * }</pre>
 *
 * <p>Timestamps are ISO-8601 instants. The value is rebuilt as the caller's requested
 * type, which must therefore be Jackson-compatible. The {@link ObjectMapper} passed in
 * decides how values are written (date handling, modules, visibility).</p>
 *
 * @since 1.0.0
 */
public class JacksonCacheSerializer implements CacheSerializer {

    private final ObjectMapper objectMapper;

    /**
     * @param objectMapper the mapper used for values (must not be null)
     */
    public JacksonCacheSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] serialize(CacheEntry entry) {
        try {
            ObjectNode document = objectMapper.createObjectNode();
            document.put("key", entry.getKey());
            document.set("value", objectMapper.valueToTree(entry.getValue()));
            document.put("createdAt", entry.getCreatedAt().toString());
            if (entry.getExpiresAt() != null) {
                document.put("expiresAt", entry.getExpiresAt().toString());
            } else {
                document.putNull("expiresAt");
            }
            ArrayNode tags = document.putArray("tags");
            entry.getTags().forEach(tags::add);
            document.put("version", entry.getVersion());
            return objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SerializationException("Failed to serialize cache entry for key " + entry.getKey() + " to JSON", e);
        }
    }

    @Override
    public CacheEntry deserialize(byte[] data, ParameterizedTypeReference<?> valueType) {
        if (data == null || data.length == 0) {
            return null;
        }
        try {
            JsonNode document = objectMapper.readTree(data);
            if (document == null || !document.isObject() || !document.hasNonNull("key")) {
                throw new SerializationException("Cache document is not a JSON object with a key", null);
            }
            JavaType javaType = objectMapper.getTypeFactory().constructType(valueType.getType());
            JsonNode valueNode = document.get("value");
            Object value = valueNode == null || valueNode.isNull()
                    ? null
                    : objectMapper.convertValue(valueNode, javaType);

            Set<String> tags = new LinkedHashSet<>();
            document.path("tags").forEach(tag -> tags.add(tag.asText()));

            return new CacheEntry(
                    document.get("key").asText(),
                    value,
                    Instant.parse(document.path("createdAt").asText()),
                    parseInstant(document.get("expiresAt")),
                    tags,
                    document.path("version").asLong(1));
        } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
            throw new SerializationException("Failed to deserialize cache entry from JSON", e);
        }
    }

    private static Instant parseInstant(JsonNode node) {
        return node == null || node.isNull() ? null : Instant.parse(node.asText());
    }
}
