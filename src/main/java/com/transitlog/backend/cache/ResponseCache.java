package com.transitlog.backend.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitlog.backend.model.CachedResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Content-addressed cache of HTTP responses.
 * Entries are keyed by the request url without its query string, so requests
 * that only differ by api key share one entry.
 */
@RequiredArgsConstructor
@Slf4j
public class ResponseCache {

    private static final String NAMESPACE = "response:";

    private final SharedCache sharedCache;
    private final ObjectMapper objectMapper;

    public Optional<CachedResponse> get(String url) {
        String key = cacheKey(url);
        try {
            Optional<String> raw = sharedCache.get(NAMESPACE + key);
            if (raw.isEmpty()) {
                log.debug("CACHE: ⚪ MISS for {}", key);
                return Optional.empty();
            }
            log.debug("CACHE: 🟢 HIT for {}", key);
            return Optional.of(objectMapper.readValue(raw.get(), CachedResponse.class));
        } catch (Exception e) {
            // An unreadable entry is treated as a miss
            log.warn("Failed to read cached response for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Store a response tagged with a max-age equal to the ttl. Best-effort:
     * failures are logged and never propagated to the fetch.
     */
    public void put(String url, CachedResponse response, Duration ttl) {
        String key = cacheKey(url);
        try {
            CachedResponse tagged = response.toBuilder()
                    .maxAgeSeconds(ttl.getSeconds())
                    .build();
            sharedCache.put(NAMESPACE + key, objectMapper.writeValueAsString(tagged), ttl);
            log.debug("CACHE: stored {} ({} bytes, max-age={}s)", key,
                    response.getBody() == null ? 0 : response.getBody().length, ttl.getSeconds());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize response for {}: {}", key, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to store response for {}: {}", key, e.getMessage());
        }
    }

    public static String cacheKey(String url) {
        int query = url.indexOf('?');
        return query < 0 ? url : url.substring(0, query);
    }
}
