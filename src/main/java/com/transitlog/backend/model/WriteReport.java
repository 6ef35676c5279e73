package com.transitlog.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of writing one batch of records to every configured storage target.
 */
@Value
@Builder
public class WriteReport {
    Dataset dataset;
    int records;
    // Target name -> whether it accepted the batch
    @Singular
    Map<String, Boolean> results;
    // Target name -> the error it failed with
    @Singular
    Map<String, Throwable> failures;

    public boolean isSuccessful() {
        return failures.isEmpty();
    }
}
