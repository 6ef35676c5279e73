package com.transitlog.backend.service;

import java.util.Map;

public interface ErrorReporter {
    /**
     * Reports an error that cannot be surfaced to a caller, such as a failed
     * background write.
     *
     * @param error   The failure
     * @param context Where it happened (e.g., dataset, target)
     */
    void report(Throwable error, Map<String, String> context);
}
