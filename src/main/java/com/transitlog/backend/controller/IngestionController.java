package com.transitlog.backend.controller;

import com.transitlog.backend.exception.UnknownDatasetException;
import com.transitlog.backend.model.Dataset;
import com.transitlog.backend.model.IngestionResult;
import com.transitlog.backend.service.BackgroundTaskObserver;
import com.transitlog.backend.service.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Ingestion", description = "Fetch, normalize and store transit datasets")
public class IngestionController {

    private final IngestionService ingestionService;
    private final BackgroundTaskObserver backgroundTaskObserver;

    @Operation(summary = "Ingest Realtime Dataset", description = "Fetches the live feed, returns the normalized records and saves them in the background.")
    @ApiResponse(responseCode = "200", description = "Records fetched, writes started")
    @GetMapping("/realtime/{dataset}")
    public List<?> ingestRealtime(
            @Parameter(description = "Realtime dataset (positions or alerts)", required = true) @PathVariable String dataset) {
        return ingest(realtime(dataset), null);
    }

    @Operation(summary = "Ingest Schedule Dataset", description = "Reads one table of the schedule snapshot published for a date, returns the normalized records and saves them in the background.")
    @ApiResponse(responseCode = "200", description = "Records fetched, writes started")
    @GetMapping("/schedule/{dataset}/{date}")
    public List<?> ingestSchedule(
            @Parameter(description = "Schedule dataset (trips, stops, routes or paths)", required = true) @PathVariable String dataset,
            @Parameter(description = "Service date (e.g. 2024-01-15)", required = true) @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ingest(schedule(dataset), date);
    }

    private List<?> ingest(Dataset dataset, LocalDate date) {
        IngestionResult<?> result = ingestionService.ingest(dataset, date);
        backgroundTaskObserver.observe(result);
        return result.getRecords();
    }

    private static Dataset realtime(String name) {
        Dataset dataset = Dataset.fromName(name);
        if (!dataset.isRealtime()) {
            throw new UnknownDatasetException(name);
        }
        return dataset;
    }

    private static Dataset schedule(String name) {
        Dataset dataset = Dataset.fromName(name);
        if (dataset.isRealtime()) {
            throw new UnknownDatasetException(name);
        }
        return dataset;
    }
}
