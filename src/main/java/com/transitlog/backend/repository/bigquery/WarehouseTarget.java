package com.transitlog.backend.repository.bigquery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitlog.backend.cache.CredentialCache;
import com.transitlog.backend.client.TokenIssuer;
import com.transitlog.backend.exception.StorageWriteException;
import com.transitlog.backend.model.Dataset;
import com.transitlog.backend.model.ServiceAccount;
import com.transitlog.backend.repository.StorageDestination;
import com.transitlog.backend.repository.StorageTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Streams records into warehouse tables with the insertAll API.
 *
 * <p>Every row carries an insertion id so the warehouse can drop duplicates of a
 * batch that is sent twice. Large batches are split into chunks that are sent
 * concurrently; the batch succeeds only if every chunk does.
 */
@Slf4j
public class WarehouseTarget implements StorageTarget {

    public static final int CHUNK_SIZE = 10_000;
    static final int MAX_ATTEMPTS = 2;
    static final String KIND = "bigquery#tableDataInsertAllRequest";
    static final String SCHEDULE_DATASET = "schedule";
    static final String RAW_TABLE = "raw";

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ServiceAccount account;
    private final TokenIssuer tokenIssuer;
    private final CredentialCache credentialCache;
    private final String endpoint;
    private final Duration timeout;
    private final Executor chunkExecutor;

    public WarehouseTarget(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, ServiceAccount account,
            TokenIssuer tokenIssuer, CredentialCache credentialCache, String endpoint, Duration timeout,
            Executor chunkExecutor) {
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.account = account;
        this.tokenIssuer = tokenIssuer;
        this.credentialCache = credentialCache;
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.chunkExecutor = chunkExecutor;
    }

    @Override
    public String getName() {
        return "warehouse";
    }

    @Override
    public StorageDestination destinationFor(Dataset dataset, String version) {
        if (dataset.isRealtime()) {
            return new StorageDestination(dataset.getName(), RAW_TABLE);
        }
        return new StorageDestination(SCHEDULE_DATASET, dataset.getName());
    }

    /**
     * Insert records into a table.
     *
     * @param namespace warehouse dataset
     * @param key       table name, optionally followed by {@code :templateSuffix}
     */
    @Override
    public boolean put(String namespace, String key, List<?> records) {
        if (records == null || records.isEmpty()) {
            return false;
        }

        String[] parts = key.split(":", 2);
        String table = parts[0];
        String templateSuffix = parts.length > 1 ? parts[1] : null;
        String url = endpoint + "/projects/" + account.getProjectId() + "/datasets/" + namespace
                + "/tables/" + table + "/insertAll";

        List<Map<String, Object>> rows = records.stream()
                .map(this::toRow)
                .collect(Collectors.toList());
        List<List<Map<String, Object>>> chunks = chunk(rows, CHUNK_SIZE);

        List<CompletableFuture<Void>> futures = chunks.stream()
                .map(chunk -> CompletableFuture.runAsync(() -> insert(url, templateSuffix, chunk), chunkExecutor))
                .collect(Collectors.toList());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        log.info("🏬 Inserted {} rows into {}.{} in {} chunk(s)", rows.size(), namespace, key, chunks.size());
        return true;
    }

    /**
     * Wrap a record as an insertAll row. The insertion id is the record id when it
     * has one, otherwise its JSON text, so identical records get identical ids.
     */
    Map<String, Object> toRow(Object record) {
        Map<String, Object> json = objectMapper.convertValue(record, ROW_TYPE);
        Object id = json.get("id");
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("insertId", id != null ? String.valueOf(id) : writeJson(json));
        row.put("json", json);
        return row;
    }

    private void insert(String url, String templateSuffix, List<Map<String, Object>> rows) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("kind", KIND);
        request.put("skipInvalidRows", true);
        request.put("ignoreUnknownValues", true);
        if (templateSuffix != null) {
            request.put("templateSuffix", templateSuffix);
        }
        request.put("rows", rows);
        String body = writeJson(request);
        String credentialKey = CredentialCache.keyFor(tokenIssuer.getIssuerUrl(), account);

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String token = attempt == 1 ? getToken(credentialKey) : refreshToken(credentialKey);
            Reply reply = post(url, token, body);

            if (reply.status == 401) {
                log.warn("🔐 Warehouse rejected token (attempt {}/{}), evicting cached credential", attempt,
                        MAX_ATTEMPTS);
                credentialCache.evict(credentialKey);
                continue;
            }
            if (reply.status < 200 || reply.status >= 300) {
                throw new StorageWriteException(getName(), reply.status, reply.body);
            }
            logInsertErrors(url, reply.body);
            return;
        }
        throw new StorageWriteException(getName(), 401, "Unauthorized after token refresh");
    }

    private String getToken(String credentialKey) {
        return credentialCache.get(credentialKey).orElseGet(() -> refreshToken(credentialKey));
    }

    private String refreshToken(String credentialKey) {
        String token = tokenIssuer.issueToken(account);
        credentialCache.put(credentialKey, token);
        return token;
    }

    private Reply post(String url, String token, String body) {
        return webClient.post()
                .uri(URI.create(url))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new Reply(response.statusCode().value(), text)))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new StorageWriteException(getName(), 504,
                        "Timed out after " + timeout.getSeconds() + "s", e))
                .block();
    }

    private void logInsertErrors(String url, String body) {
        if (body == null || body.isBlank()) {
            return;
        }
        try {
            JsonNode errors = objectMapper.readTree(body).path("insertErrors");
            if (errors.isArray() && errors.size() > 0) {
                log.warn("⚠️ {} row(s) rejected by {}: {}", errors.size(), url, errors.get(0));
            }
        } catch (JsonProcessingException e) {
            log.warn("Unreadable insertAll reply from {}: {}", url, e.getMessage());
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize warehouse rows", e);
        }
    }

    public static <T> List<List<T>> chunk(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(items.subList(i, Math.min(i + size, items.size())));
        }
        return chunks;
    }

    private static final class Reply {
        private final int status;
        private final String body;

        private Reply(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }
}
