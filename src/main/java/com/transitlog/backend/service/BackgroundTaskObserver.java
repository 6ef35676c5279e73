package com.transitlog.backend.service;

import com.transitlog.backend.model.IngestionResult;
import com.transitlog.backend.model.WriteReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Watches background writes that nobody waits for and reports every failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BackgroundTaskObserver {

    private final ErrorReporter errorReporter;
    private final PendingWrites pendingWrites;

    /**
     * @return the same write handle with failure reporting attached, tracked in
     *         {@link PendingWrites} until it completes
     */
    public CompletableFuture<WriteReport> observe(IngestionResult<?> result) {
        String dataset = result.getDataset().getName();
        return pendingWrites.track(result.getWrites().whenComplete((report, error) -> {
            if (error != null) {
                errorReporter.report(error, Map.of("dataset", dataset, "stage", "write"));
                return;
            }
            report.getFailures().forEach((target, failure) -> errorReporter.report(failure,
                    Map.of("dataset", dataset, "stage", "write", "target", target)));
            if (report.isSuccessful()) {
                log.debug("Background writes for {} finished: {}", dataset, report.getResults());
            }
        }));
    }
}
