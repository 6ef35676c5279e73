package com.transitlog.backend.client;

import com.transitlog.backend.model.ServiceAccount;

/**
 * Issues bearer tokens for a service account.
 */
public interface TokenIssuer {

    String SCOPE = "https://www.googleapis.com/auth/cloud-platform";

    /**
     * Url of the issuer, part of the credential cache key.
     */
    String getIssuerUrl();

    /**
     * Request a fresh token. Never served from a cache.
     */
    String issueToken(ServiceAccount account);
}
