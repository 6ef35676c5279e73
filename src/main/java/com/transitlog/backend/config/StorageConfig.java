package com.transitlog.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitlog.backend.cache.CredentialCache;
import com.transitlog.backend.client.GoogleTokenIssuer;
import com.transitlog.backend.client.HttpTokenIssuer;
import com.transitlog.backend.client.TokenIssuer;
import com.transitlog.backend.model.ServiceAccount;
import com.transitlog.backend.repository.StorageTarget;
import com.transitlog.backend.repository.bigquery.WarehouseTarget;
import com.transitlog.backend.repository.s3.ObjectStoreTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Configuration for the storage targets.
 * Each target is only created when it is enabled, so a deployment can write to
 * either backend or both.
 */
@Configuration
@Slf4j
public class StorageConfig {

    @Value("${http.timeout-seconds:30}")
    private int timeoutSeconds;

    @Bean(name = "storageExecutor", destroyMethod = "shutdown")
    public ExecutorService storageExecutor(@Value("${storage.threads:4}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }

    @Bean(name = "warehouseChunkExecutor", destroyMethod = "shutdown")
    public ExecutorService warehouseChunkExecutor(@Value("${storage.warehouse.threads:4}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    @ConditionalOnProperty(name = "storage.object.enabled", havingValue = "true")
    public S3Client s3Client(
            @Value("${storage.object.access-key-id:}") String accessKeyId,
            @Value("${storage.object.secret-access-key:}") String secretAccessKey,
            @Value("${storage.object.region:us-west-2}") String region,
            @Value("${storage.object.endpoint:}") String endpoint) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(credentials(accessKeyId, secretAccessKey));

        // S3 compatible stores are usually addressed by path rather than by bucket subdomain
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint))
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        }

        log.info("✅ Object store client initialized for region {}", region);
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "storage.object.enabled", havingValue = "true")
    public StorageTarget objectStoreTarget(S3Client s3Client, ObjectMapper objectMapper,
            @Value("${storage.object.bucket}") String bucket) {
        return new ObjectStoreTarget(s3Client, objectMapper, bucket);
    }

    @Bean
    @ConditionalOnProperty(name = "storage.warehouse.enabled", havingValue = "true")
    public ServiceAccount warehouseServiceAccount(ObjectMapper objectMapper,
            @Value("${storage.warehouse.secret:}") String secret) {
        ServiceAccount account = ServiceAccount.decode(secret, objectMapper);
        log.info("🔐 Loaded warehouse service account {} for project {}", account.getClientEmail(),
                account.getProjectId());
        return account;
    }

    @Bean
    @ConditionalOnProperty(name = "storage.warehouse.enabled", havingValue = "true")
    public TokenIssuer tokenIssuer(WebClient.Builder webClientBuilder,
            @Value("${storage.warehouse.token-issuer:proxy}") String issuer,
            @Value("${storage.warehouse.token-issuer-url:}") String issuerUrl) {
        if ("google".equalsIgnoreCase(issuer)) {
            return new GoogleTokenIssuer();
        }
        if (!"proxy".equalsIgnoreCase(issuer)) {
            throw new IllegalStateException("Unknown token issuer '" + issuer + "' (expected proxy or google)");
        }
        if (issuerUrl == null || issuerUrl.isBlank()) {
            throw new IllegalStateException("storage.warehouse.token-issuer-url is required for the proxy issuer");
        }
        return new HttpTokenIssuer(webClientBuilder, issuerUrl, Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    @ConditionalOnProperty(name = "storage.warehouse.enabled", havingValue = "true")
    public StorageTarget warehouseTarget(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
            ServiceAccount warehouseServiceAccount, TokenIssuer tokenIssuer, CredentialCache credentialCache,
            @Value("${storage.warehouse.endpoint:https://www.googleapis.com/bigquery/v2}") String endpoint,
            @Qualifier("warehouseChunkExecutor") ExecutorService warehouseChunkExecutor) {
        return new WarehouseTarget(webClientBuilder, objectMapper, warehouseServiceAccount, tokenIssuer,
                credentialCache, endpoint, Duration.ofSeconds(timeoutSeconds), warehouseChunkExecutor);
    }

    private static AwsCredentialsProvider credentials(String accessKeyId, String secretAccessKey) {
        if (accessKeyId == null || accessKeyId.isBlank()) {
            log.info("🔐 No object store keys configured, using the default AWS credential chain");
            return DefaultCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }
}
