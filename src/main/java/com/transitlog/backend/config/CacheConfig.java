package com.transitlog.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitlog.backend.cache.CredentialCache;
import com.transitlog.backend.cache.InMemorySharedCache;
import com.transitlog.backend.cache.RedisSharedCache;
import com.transitlog.backend.cache.ResponseCache;
import com.transitlog.backend.cache.SharedCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Shared cache backend selection. Redis keeps responses and credentials warm
 * across instances; the in-memory cache is enough for a single process.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "cache.backend", havingValue = "redis")
    public SharedCache redisSharedCache(StringRedisTemplate redisTemplate,
            @Value("${cache.redis.prefix:transitlog:}") String prefix) {
        log.info("✅ Using Redis shared cache (prefix '{}')", prefix);
        return new RedisSharedCache(redisTemplate, prefix);
    }

    @Bean
    @ConditionalOnProperty(name = "cache.backend", havingValue = "memory", matchIfMissing = true)
    public SharedCache inMemorySharedCache(Clock clock) {
        log.info("✅ Using in-memory shared cache");
        return new InMemorySharedCache(clock);
    }

    @Bean
    public ResponseCache responseCache(SharedCache sharedCache, ObjectMapper objectMapper) {
        return new ResponseCache(sharedCache, objectMapper);
    }

    @Bean
    public CredentialCache credentialCache(SharedCache sharedCache) {
        return new CredentialCache(sharedCache);
    }
}
