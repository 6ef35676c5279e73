package com.transitlog.backend.service;

import com.transitlog.backend.model.Dataset;
import com.transitlog.backend.model.WriteReport;
import com.transitlog.backend.repository.StorageDestination;
import com.transitlog.backend.repository.StorageTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Fans a batch of records out to every configured storage target.
 * Writes run on the storage executor and never block the caller.
 */
@Service
@Slf4j
public class StorageSink {

    private final ObjectProvider<StorageTarget> targets;
    private final Executor storageExecutor;

    public StorageSink(ObjectProvider<StorageTarget> targets, @Qualifier("storageExecutor") Executor storageExecutor) {
        this.targets = targets;
        this.storageExecutor = storageExecutor;
    }

    /**
     * Start writing a batch to every target.
     *
     * @param dataset the kind of records
     * @param version timestamp path for realtime data, ISO date for schedule data
     * @param records the records to write
     * @return a report of every target's outcome; never completes exceptionally
     */
    public CompletableFuture<WriteReport> writeAsync(Dataset dataset, String version, List<?> records) {
        List<StorageTarget> configured = targets.orderedStream().collect(Collectors.toList());
        if (configured.isEmpty()) {
            log.warn("⚠️ No storage targets configured, {} {} records not saved", records.size(), dataset.getName());
            return CompletableFuture.completedFuture(WriteReport.builder()
                    .dataset(dataset)
                    .records(records.size())
                    .build());
        }

        List<CompletableFuture<TargetOutcome>> writes = configured.stream()
                .map(target -> CompletableFuture
                        .supplyAsync(() -> write(target, dataset, version, records), storageExecutor)
                        .handle((written, error) -> new TargetOutcome(target.getName(),
                                Boolean.TRUE.equals(written), unwrap(error))))
                .collect(Collectors.toList());

        return CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]))
                .thenApply(done -> {
                    WriteReport.WriteReportBuilder report = WriteReport.builder()
                            .dataset(dataset)
                            .records(records.size());
                    for (CompletableFuture<TargetOutcome> write : writes) {
                        TargetOutcome outcome = write.join();
                        report.result(outcome.target, outcome.written);
                        if (outcome.error != null) {
                            report.failure(outcome.target, outcome.error);
                        }
                    }
                    WriteReport result = report.build();
                    log.info("💾 WRITE SUMMARY: {} | {} records | {}", dataset.getName(), records.size(),
                            result.getResults());
                    return result;
                });
    }

    private boolean write(StorageTarget target, Dataset dataset, String version, List<?> records) {
        StorageDestination destination = target.destinationFor(dataset, version);
        log.debug("Writing {} {} records to {} {}/{}", records.size(), dataset.getName(), target.getName(),
                destination.getNamespace(), destination.getKey());
        return target.put(destination.getNamespace(), destination.getKey(), records);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static final class TargetOutcome {
        private final String target;
        private final boolean written;
        private final Throwable error;

        private TargetOutcome(String target, boolean written, Throwable error) {
            this.target = target;
            this.written = written;
            this.error = error;
        }
    }
}
