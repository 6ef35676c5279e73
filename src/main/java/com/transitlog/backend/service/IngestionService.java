package com.transitlog.backend.service;

import com.transitlog.backend.client.RealtimeFeedClient;
import com.transitlog.backend.client.ScheduleSnapshotClient;
import com.transitlog.backend.exception.MissingServiceDateException;
import com.transitlog.backend.model.Dataset;
import com.transitlog.backend.model.IngestionResult;
import com.transitlog.backend.model.WriteReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the pipeline: fetch a dataset, normalize it and hand the records to the
 * storage sink. Returns as soon as the records are ready; writes continue in the
 * background.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

        static final DateTimeFormatter REALTIME_VERSION = DateTimeFormatter.ofPattern("yyyy/MM/dd/HHmmss");

        private final RealtimeFeedClient realtimeClient;
        private final ScheduleSnapshotClient scheduleClient;
        private final StorageSink storageSink;
        private final ErrorReporter errorReporter;
        private final Clock clock;

        @Value("${transit.timezone:America/Vancouver}")
        private String timezone;

        /**
         * Ingest one dataset.
         *
         * @param dataset the dataset to fetch
         * @param date    service date of the schedule snapshot; ignored for realtime datasets
         * @return the normalized records and the handle of the background writes
         */
        public IngestionResult<?> ingest(Dataset dataset, LocalDate date) {
                long startMillis = clock.millis();
                log.info("───────────────────────────────────────────────────────────────────");
                log.info("🚌 INGEST: {} | Date: {}", dataset.getName().toUpperCase(),
                                dataset.isRealtime() ? "live" : date);
                log.info("───────────────────────────────────────────────────────────────────");

                List<?> records = fetch(dataset, date);
                String version = dataset.isRealtime() ? realtimeVersion() : date.toString();
                CompletableFuture<WriteReport> writes = storageSink.writeAsync(dataset, version, records);

                log.info("✅ SUMMARY: {} | {} records | version {} | Took: {}ms", dataset.getName(), records.size(),
                                version, clock.millis() - startMillis);
                return new IngestionResult<>(dataset, records, writes);
        }

        /**
         * Ingest every realtime dataset concurrently. A dataset that fails to fetch
         * is reported and left out of the result.
         */
        public List<IngestionResult<?>> ingestRealtime() {
                List<Dataset> datasets = List.of(Dataset.POSITIONS, Dataset.ALERTS);
                ExecutorService executor = Executors.newFixedThreadPool(datasets.size());
                try {
                        Map<Dataset, CompletableFuture<IngestionResult<?>>> futures = new EnumMap<>(Dataset.class);
                        for (Dataset dataset : datasets) {
                                futures.put(dataset, CompletableFuture
                                                .<IngestionResult<?>>supplyAsync(() -> ingest(dataset, null), executor));
                        }

                        List<IngestionResult<?>> results = new ArrayList<>();
                        for (Dataset dataset : datasets) {
                                try {
                                        results.add(futures.get(dataset).join());
                                } catch (CompletionException e) {
                                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                                        log.error("❌ STATUS: FAILED | {} ingestion failed: {}", dataset.getName(),
                                                        cause.getMessage());
                                        errorReporter.report(cause, Map.of("dataset", dataset.getName(),
                                                        "stage", "fetch"));
                                }
                        }
                        return results;
                } finally {
                        executor.shutdown();
                }
        }

        private List<?> fetch(Dataset dataset, LocalDate date) {
                if (!dataset.isRealtime() && date == null) {
                        throw new MissingServiceDateException(dataset);
                }
                switch (dataset) {
                        case POSITIONS:
                                return realtimeClient.getPositions();
                        case ALERTS:
                                return realtimeClient.getAlerts();
                        case TRIPS:
                                return scheduleClient.getTrips(date);
                        case STOPS:
                                return scheduleClient.getStops(date);
                        case ROUTES:
                                return scheduleClient.getRoutes(date);
                        case PATHS:
                                return scheduleClient.getPaths(date);
                        default:
                                throw new IllegalArgumentException("Unsupported dataset " + dataset.getName());
                }
        }

        private String realtimeVersion() {
                return ZonedDateTime.now(clock.withZone(ZoneId.of(timezone))).format(REALTIME_VERSION);
        }
}
