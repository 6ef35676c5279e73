package com.transitlog.backend.cache;

import com.transitlog.backend.model.ServiceAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Bearer tokens shared across invocations, keyed by issuer, project and key id.
 */
@RequiredArgsConstructor
@Slf4j
public class CredentialCache {

    public static final Duration TOKEN_TTL = Duration.ofHours(1);

    private static final String NAMESPACE = "credential:";

    private final SharedCache sharedCache;

    public static String keyFor(String issuerUrl, ServiceAccount account) {
        return issuerUrl + "/" + account.getProjectId() + "/" + account.getPrivateKeyId();
    }

    public Optional<String> get(String key) {
        try {
            return sharedCache.get(NAMESPACE + key);
        } catch (RuntimeException e) {
            log.warn("Failed to read cached credential: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String key, String token) {
        try {
            sharedCache.put(NAMESPACE + key, token, TOKEN_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache credential: {}", e.getMessage());
        }
    }

    public void evict(String key) {
        try {
            sharedCache.evict(NAMESPACE + key);
        } catch (RuntimeException e) {
            log.warn("Failed to evict cached credential: {}", e.getMessage());
        }
    }
}
