package com.transitlog.backend.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Spreads realtime API requests over every configured key.
 * The upstream API enforces a daily quota per key, so each request picks a key
 * uniformly at random. No state is kept between calls.
 */
@Component
@Slf4j
public class ApiKeyRotator {

    private final List<String> keys;
    private final int quotaPerKey;
    private final long quotaWindowSeconds;

    public ApiKeyRotator(@Value("${realtime.api.keys}") String keys,
            @Value("${realtime.api.quota-per-key:1000}") int quotaPerKey,
            @Value("${realtime.api.quota-window-seconds:86400}") long quotaWindowSeconds) {
        this.keys = parseKeys(keys);
        if (this.keys.isEmpty()) {
            throw new IllegalStateException("No realtime API keys configured (realtime.api.keys)");
        }
        if (quotaPerKey <= 0 || quotaWindowSeconds <= 0) {
            throw new IllegalStateException("Realtime API quota must be positive");
        }
        this.quotaPerKey = quotaPerKey;
        this.quotaWindowSeconds = quotaWindowSeconds;
        log.info("🔑 Realtime API configured with {} key(s), cache ttl {}s", this.keys.size(),
                realtimeTtl().getSeconds());
    }

    public String nextKey() {
        return keys.get(ThreadLocalRandom.current().nextInt(keys.size()));
    }

    public int size() {
        return keys.size();
    }

    /**
     * Time to cache realtime responses so the whole key pool stays within quota:
     * window / (requests per key per window * key count), rounded up.
     */
    public Duration realtimeTtl() {
        long requests = (long) quotaPerKey * keys.size();
        return Duration.ofSeconds((quotaWindowSeconds + requests - 1) / requests);
    }

    static List<String> parseKeys(String keys) {
        if (keys == null) {
            return List.of();
        }
        return Arrays.stream(keys.split(","))
                .map(String::trim)
                .filter(key -> !key.isEmpty())
                .collect(Collectors.toList());
    }
}
