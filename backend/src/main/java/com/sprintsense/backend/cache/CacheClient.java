package com.sprintsense.backend.cache;

import java.time.Duration;

/**
 * Minimal key-value store contract used by the goal cache. Every operation may
 * fail with a runtime exception.
 */
public interface CacheClient {

    /**
     * @return the stored value, or null on a miss
     */
    String get(String key);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);
}
