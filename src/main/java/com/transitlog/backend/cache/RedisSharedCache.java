package com.transitlog.backend.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link SharedCache} backed by Redis, so cached responses and credentials
 * survive across invocations and instances.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisSharedCache implements SharedCache {

    private final RedisTemplate<String, String> redisTemplate;
    private final String prefix;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(prefix + key));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            log.trace("Skipping Redis save with non-positive ttl: key={}", key);
            return;
        }
        redisTemplate.opsForValue().set(prefix + key, value, ttl);
        log.trace("Saved to Redis: key={}, ttl={}s", key, ttl.getSeconds());
    }

    @Override
    public void evict(String key) {
        redisTemplate.delete(prefix + key);
        log.debug("Deleted from Redis: key={}", prefix + key);
    }
}
