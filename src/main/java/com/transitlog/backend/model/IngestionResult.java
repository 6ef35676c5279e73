package com.transitlog.backend.model;

import lombok.Value;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Records produced by one pipeline invocation together with the handle of the
 * storage writes still running in the background.
 */
@Value
public class IngestionResult<T> {
    Dataset dataset;
    List<T> records;
    CompletableFuture<WriteReport> writes;
}
