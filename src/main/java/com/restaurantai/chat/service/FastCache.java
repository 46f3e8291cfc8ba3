package com.restaurantai.chat.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Minimal expiring key/value store fronting the durable store.
 * Implementations throw {@link CacheUnavailableException} when the backing cache cannot be reached.
 */
public interface FastCache {

    Optional<String> get(String key);

    void setWithExpiry(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Round-trips to the cache; used by the health probe.
     */
    void ping();
}
