package com.pedromossi.clinicache.tag;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-memory index from tags to the cache keys written under them.
 *
 * <p>A reverse index (key to tags) is maintained alongside so that deleting or
 * rewriting a key removes it from every tag it was registered under. Tags whose key
 * set becomes empty are pruned.</p>
 *
 * <p>Not thread-safe. The owning cache manager guards every call with its lock.</p>
 *
 * @since 1.0.0
 */
public class TagRegistry {

    private final Map<String, Set<String>> keysByTag = new HashMap<>();

    private final Map<String, Set<String>> tagsByKey = new HashMap<>();

    /**
     * Indexes a key under the given tags, replacing whatever tags it had before.
     *
     * @param key the cache key
     * @param tags the key's tags (may be empty)
     */
    public void register(String key, Set<String> tags) {
        unregister(key);
        if (tags == null || tags.isEmpty()) {
            return;
        }
        Set<String> ownTags = new LinkedHashSet<>(tags);
        tagsByKey.put(key, ownTags);
        for (String tag : ownTags) {
            keysByTag.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(key);
        }
    }

    /**
     * Removes a key from every tag it is indexed under.
     *
     * @param key the cache key
     * @return the tags the key was indexed under
     */
    public Set<String> unregister(String key) {
        Set<String> tags = tagsByKey.remove(key);
        if (tags == null) {
            return Set.of();
        }
        for (String tag : tags) {
            Set<String> keys = keysByTag.get(tag);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    keysByTag.remove(tag);
                }
            }
        }
        return tags;
    }

    /**
     * Drops a tag and returns the keys that were indexed under it. The keys stay indexed
     * under their other tags until they are {@linkplain #unregister unregistered}.
     *
     * @param tag the tag
     * @return the keys, empty if the tag is unknown
     */
    public Set<String> removeTag(String tag) {
        Set<String> keys = keysByTag.remove(tag);
        return keys == null ? Set.of() : keys;
    }

    /**
     * @param tag the tag
     * @return a read-only view of the keys under the tag
     */
    public Set<String> keysFor(String tag) {
        Set<String> keys = keysByTag.get(tag);
        return keys == null ? Set.of() : Collections.unmodifiableSet(keys);
    }

    /**
     * @param key the cache key
     * @return a read-only view of the key's tags
     */
    public Set<String> tagsFor(String key) {
        Set<String> tags = tagsByKey.get(key);
        return tags == null ? Set.of() : Collections.unmodifiableSet(tags);
    }

    public boolean containsTag(String tag) {
        return keysByTag.containsKey(tag);
    }

    public int tagCount() {
        return keysByTag.size();
    }

    public void clear() {
        keysByTag.clear();
        tagsByKey.clear();
    }
}
