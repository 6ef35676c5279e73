package com.transitlog.backend.client;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.transitlog.backend.model.ServiceAccount;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Issues tokens directly with google-auth-library, for deployments that can
 * sign the service account assertion themselves.
 */
@Slf4j
public class GoogleTokenIssuer implements TokenIssuer {

    static final String TOKEN_URL = "https://oauth2.googleapis.com/token";

    @Override
    public String getIssuerUrl() {
        return TOKEN_URL;
    }

    @Override
    public String issueToken(ServiceAccount account) {
        try {
            GoogleCredentials credentials = GoogleCredentials
                    .fromStream(new ByteArrayInputStream(account.getKeyFile()))
                    .createScoped(List.of(SCOPE));
            AccessToken token = credentials.refreshAccessToken();
            log.info("🔐 Issued fresh Google token for project {}", account.getProjectId());
            return token.getTokenValue();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not refresh oauth token for " + account.getProjectId(), e);
        }
    }
}
