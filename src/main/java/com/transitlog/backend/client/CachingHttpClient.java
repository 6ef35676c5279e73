package com.transitlog.backend.client;

import com.transitlog.backend.cache.ResponseCache;
import com.transitlog.backend.exception.UpstreamHttpException;
import com.transitlog.backend.model.CachedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * GET requests that go through the {@link ResponseCache}.
 * Only successful responses are cached; failed ones are handed back to the
 * caller so it can report the status.
 */
@Component
@Slf4j
public class CachingHttpClient {

    private final WebClient webClient;
    private final ResponseCache responseCache;
    private final Duration timeout;
    private final Clock clock;

    public CachingHttpClient(WebClient.Builder webClientBuilder, ResponseCache responseCache,
            @Value("${http.timeout-seconds:30}") int timeoutSeconds,
            @Value("${http.max-in-memory-size:134217728}") int maxInMemorySize) {
        this.responseCache = responseCache;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.clock = Clock.systemUTC();
        this.webClient = webClientBuilder
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(maxInMemorySize)) // schedule archives are tens of MB
                .build();
    }

    /**
     * Fetch a url, serving it from the cache when possible.
     *
     * @param url full request url, including any query parameters
     * @param ttl how long a successful response may be reused
     * @return the cached or fresh response, successful or not
     */
    public CachedResponse fetch(String url, Duration ttl) {
        Optional<CachedResponse> cached = responseCache.get(url);
        if (cached.isPresent()) {
            return cached.get();
        }

        CachedResponse response = get(url);
        if (response.isOk()) {
            responseCache.put(url, response, ttl);
        } else {
            log.warn("⚠️ {} returned status {}", ResponseCache.cacheKey(url), response.getStatus());
        }
        return response;
    }

    private CachedResponse get(String url) {
        log.debug("📡 GET {}", ResponseCache.cacheKey(url));
        return webClient.get()
                .uri(URI.create(url))
                .exchangeToMono(response -> response.bodyToMono(byte[].class)
                        .defaultIfEmpty(new byte[0])
                        .map(body -> CachedResponse.builder()
                                .status(response.statusCode().value())
                                .body(body)
                                .contentType(response.headers().contentType()
                                        .map(MediaType::toString)
                                        .orElse(null))
                                .storedAt(clock.instant().getEpochSecond())
                                .build()))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new UpstreamHttpException(
                        "Timed out after " + timeout.getSeconds() + "s", 504, ResponseCache.cacheKey(url)))
                .block();
    }
}
