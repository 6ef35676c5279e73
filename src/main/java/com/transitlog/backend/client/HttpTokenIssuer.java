package com.transitlog.backend.client;

import com.transitlog.backend.exception.UpstreamHttpException;
import com.transitlog.backend.model.ServiceAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Gets tokens from a token-issuing proxy that signs the service account
 * assertion on our behalf. The proxy answers with the raw token as its body.
 */
@Slf4j
public class HttpTokenIssuer implements TokenIssuer {

    private final WebClient webClient;
    private final String issuerUrl;
    private final Duration timeout;

    public HttpTokenIssuer(WebClient.Builder webClientBuilder, String issuerUrl, Duration timeout) {
        this.webClient = webClientBuilder.build();
        this.issuerUrl = issuerUrl;
        this.timeout = timeout;
    }

    @Override
    public String getIssuerUrl() {
        return issuerUrl;
    }

    @Override
    public String issueToken(ServiceAccount account) {
        Map<String, Object> body = Map.of(
                "credentials", Map.of(
                        "client_email", account.getClientEmail(),
                        "private_key", account.getPrivateKey()),
                "projectId", account.getProjectId(),
                "scopes", SCOPE);

        TokenReply reply = webClient.post()
                .uri(URI.create(issuerUrl))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new TokenReply(response.statusCode().value(), text)))
                .timeout(timeout)
                .block();

        if (reply == null || reply.status < 200 || reply.status >= 300) {
            int status = reply == null ? 0 : reply.status;
            throw new UpstreamHttpException("Could not refresh oauth token", status, issuerUrl);
        }
        log.info("🔐 Issued fresh token for project {}", account.getProjectId());
        return reply.token.trim();
    }

    private static final class TokenReply {
        private final int status;
        private final String token;

        private TokenReply(int status, String token) {
            this.status = status;
            this.token = token;
        }
    }
}
