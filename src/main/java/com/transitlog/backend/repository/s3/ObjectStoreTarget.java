package com.transitlog.backend.repository.s3;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transitlog.backend.exception.StorageWriteException;
import com.transitlog.backend.model.Dataset;
import com.transitlog.backend.repository.StorageDestination;
import com.transitlog.backend.repository.StorageTarget;
import com.transitlog.backend.util.CsvTables;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Saves batches of records as CSV objects in an S3 compatible bucket.
 * The header is taken from the fields of the first record.
 */
@Slf4j
public class ObjectStoreTarget implements StorageTarget {

    static final String CONTENT_TYPE = "text/csv";

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final S3Client s3Client;
    private final ObjectMapper objectMapper;
    private final String bucket;

    public ObjectStoreTarget(S3Client s3Client, ObjectMapper objectMapper, String bucket) {
        this.s3Client = s3Client;
        this.objectMapper = objectMapper;
        this.bucket = bucket;
    }

    @Override
    public String getName() {
        return "object-store";
    }

    @Override
    public StorageDestination destinationFor(Dataset dataset, String version) {
        if (dataset.isRealtime()) {
            return new StorageDestination(bucket, dataset.getName() + "/raw/" + version);
        }
        return new StorageDestination(bucket, "schedule/" + version + "/" + dataset.getName());
    }

    @Override
    public boolean put(String namespace, String key, List<?> records) {
        if (records == null || records.isEmpty()) {
            return false;
        }

        List<Map<String, Object>> rows = records.stream()
                .map(this::toRow)
                .collect(Collectors.toList());
        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        String csv = CsvTables.write(columns, rows);

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(namespace)
                .key(key)
                .contentType(CONTENT_TYPE)
                .contentDisposition("attachment;filename=" + fileName(key) + ".csv")
                .build();

        try {
            s3Client.putObject(request, RequestBody.fromString(csv, StandardCharsets.UTF_8));
        } catch (S3Exception e) {
            String body = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            throw new StorageWriteException(getName(), e.statusCode(), body, e);
        }

        log.info("☁️ Saved {} rows to s3://{}/{}", rows.size(), namespace, key);
        return true;
    }

    private Map<String, Object> toRow(Object record) {
        Map<String, Object> row = objectMapper.convertValue(record, ROW_TYPE);
        // Id lists become a single comma-separated field
        row.replaceAll((column, value) -> value instanceof Collection
                ? ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.joining(","))
                : value);
        return row;
    }

    private static String fileName(String key) {
        return key.substring(key.lastIndexOf('/') + 1);
    }
}
