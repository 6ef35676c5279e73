package com.transitlog.backend.repository;

import com.transitlog.backend.model.Dataset;

import java.util.List;

/**
 * A storage backend that accepts batches of domain records.
 * Allows plug-and-play storage implementations.
 */
public interface StorageTarget {

    /**
     * Name used in write reports and logs.
     */
    String getName();

    /**
     * Where a batch of a dataset is written.
     *
     * @param dataset the kind of records
     * @param version timestamp path for realtime data, ISO date for schedule data
     */
    StorageDestination destinationFor(Dataset dataset, String version);

    /**
     * Write a batch of records.
     *
     * @param namespace bucket or warehouse dataset
     * @param key       object key or table name
     * @param records   domain records, serialized with their JSON property names
     * @return {@code true} if the batch was written, {@code false} if there was nothing to write
     * @throws com.transitlog.backend.exception.StorageWriteException if the backend rejected the write
     */
    boolean put(String namespace, String key, List<?> records);
}
