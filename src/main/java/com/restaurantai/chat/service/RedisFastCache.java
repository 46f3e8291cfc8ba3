package com.restaurantai.chat.service;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link FastCache} on Redis. Connection and command timeouts come from {@code spring.data.redis.timeout}.
 */
public class RedisFastCache implements FastCache {

    private final StringRedisTemplate redisTemplate;

    public RedisFastCache(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis GET failed for " + key, e);
        }
    }

    @Override
    public void setWithExpiry(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis SETEX failed for " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis DEL failed for " + key, e);
        }
    }

    @Override
    public void ping() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            if (!"PONG".equalsIgnoreCase(pong)) {
                throw new CacheUnavailableException("Unexpected Redis PING reply: " + pong, null);
            }
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis PING failed", e);
        }
    }
}
