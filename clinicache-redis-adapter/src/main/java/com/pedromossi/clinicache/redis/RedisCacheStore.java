package com.pedromossi.clinicache.redis;

import com.pedromossi.clinicache.CacheEntry;
import com.pedromossi.clinicache.CacheStore;
import com.pedromossi.clinicache.serializer.CacheSerializer;
import com.pedromossi.clinicache.store.BackendUnavailableException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Durable {@link CacheStore} backed by Redis.
 *
 * <p>Entries are stored as encoded documents (see {@link CacheSerializer}) under
 * {@code keyPrefix + key}, with a native Redis TTL equal to the entry's time to live.
 * Redis therefore drops expired entries by itself, and entries survive application
 * restarts until then.</p>
 *
 * <p><strong>Error handling:</strong> Spring {@link DataAccessException}s (connection
 * refused, command timeout, ...) are translated into {@link BackendUnavailableException}.
 * Codec failures surface as
 * {@link com.pedromossi.clinicache.serializer.SerializationException}. Every call records
 * whether Redis answered, which is what {@link #isAvailable()} reports.</p>
 *
 * <p>{@link #clear()} removes only keys under this store's prefix. It never flushes the
 * database, which may be shared with other applications.</p>
 *
 * @since 1.0.0
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final String keyPrefix;
    private final CacheSerializer serializer;
    private final AtomicBoolean available = new AtomicBoolean(true);

    /**
     * Creates a new Redis store.
     *
     * @param redisTemplate template with a string key serializer and a raw byte value serializer
     * @param keyPrefix namespace prepended to every key, e.g. {@code clinicache:}
     * @param serializer the entry codec
     */
    public RedisCacheStore(RedisTemplate<String, byte[]> redisTemplate, String keyPrefix, CacheSerializer serializer) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.serializer = serializer;
        log.info("RedisCacheStore initialized. Serializer: {}, key prefix: '{}'",
                serializer.getClass().getSimpleName(), this.keyPrefix);
    }

    @Override
    public CacheEntry get(String key, ParameterizedTypeReference<?> valueType) {
        byte[] data = call("get", key, () -> redisTemplate.opsForValue().get(keyPrefix + key));
        return data == null ? null : serializer.deserialize(data, valueType);
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        byte[] data = serializer.serialize(entry);
        call("set", entry.getKey(), () -> {
            redisTemplate.opsForValue().set(keyPrefix + entry.getKey(), data, ttl);
            return null;
        });
    }

    @Override
    public boolean evict(String key) {
        Boolean deleted = call("delete", key, () -> redisTemplate.delete(keyPrefix + key));
        return Boolean.TRUE.equals(deleted);
    }

    @Override
    public void clear() {
        Long removed = call("clear", keyPrefix + "*", () -> {
            Set<String> keys = redisTemplate.keys(keyPrefix + "*");
            return keys == null || keys.isEmpty() ? 0L : redisTemplate.delete(keys);
        });
        log.info("Cleared {} keys under prefix '{}' from Redis", removed, keyPrefix);
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    /**
     * Sends a PING to Redis.
     *
     * @return {@code true} if Redis answered
     */
    public boolean ping() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            available.set(true);
            log.info("Redis ping answered: {}", reply);
            return true;
        } catch (RuntimeException e) {
            available.set(false);
            log.warn("Redis is not reachable, cache will run in process only until it answers: {}", e.getMessage());
            return false;
        }
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    private <T> T call(String operation, String key, Supplier<T> command) {
        try {
            T result = command.get();
            if (!available.getAndSet(true)) {
                log.info("Redis is reachable again");
            }
            return result;
        } catch (DataAccessException e) {
            if (available.getAndSet(false)) {
                log.warn("Redis became unreachable during {}: {}", operation, e.getMessage());
            }
            throw new BackendUnavailableException("Redis " + operation + " failed for key " + key, e);
        }
    }
}
