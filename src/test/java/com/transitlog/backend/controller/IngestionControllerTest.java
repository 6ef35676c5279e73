package com.transitlog.backend.controller;

import com.transitlog.backend.exception.GlobalExceptionHandler;
import com.transitlog.backend.exception.MissingServiceDateException;
import com.transitlog.backend.exception.UpstreamHttpException;
import com.transitlog.backend.model.Dataset;
import com.transitlog.backend.model.IngestionResult;
import com.transitlog.backend.model.Position;
import com.transitlog.backend.model.Trip;
import com.transitlog.backend.service.BackgroundTaskObserver;
import com.transitlog.backend.service.IngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class IngestionControllerTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    @Mock
    private IngestionService ingestionService;
    @Mock
    private BackgroundTaskObserver backgroundTaskObserver;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new IngestionController(ingestionService, backgroundTaskObserver))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testRealtime_ReturnsRecordsAndObservesWrites() throws Exception {
        // Given
        Position position = Position.builder().vehicle(9431).trip(1).route(2).longitude(-123.1).latitude(49.2)
                .timestamp(1705305590L).date(DATE).build();
        IngestionResult<Position> result = new IngestionResult<>(Dataset.POSITIONS, List.of(position),
                new CompletableFuture<>());
        doReturn(result).when(ingestionService).ingest(Dataset.POSITIONS, null);

        // When / Then
        mockMvc.perform(get("/api/v1/realtime/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("9431-1705305590"))
                .andExpect(jsonPath("$[0].location").value("POINT(-123.1 49.2)"));

        verify(backgroundTaskObserver).observe(result);
    }

    @Test
    void testSchedule_ParsesDate() throws Exception {
        Trip trip = Trip.builder().id(42).route(7).headsign("Downtown").block(99).path(3).build();
        doReturn(new IngestionResult<>(Dataset.TRIPS, List.of(trip), new CompletableFuture<>()))
                .when(ingestionService).ingest(Dataset.TRIPS, DATE);

        mockMvc.perform(get("/api/v1/schedule/trips/2024-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].headsign").value("Downtown"))
                .andExpect(jsonPath("$[0].path").value(3));
    }

    @Test
    void testUnknownDataset_NotFound() throws Exception {
        mockMvc.perform(get("/api/v1/realtime/weather"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown dataset: weather"));

        verifyNoInteractions(ingestionService);
    }

    @Test
    void testScheduleDatasetOnRealtimeRoute_NotFound() throws Exception {
        mockMvc.perform(get("/api/v1/realtime/trips"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/v1/schedule/positions/2024-01-15"))
                .andExpect(status().isNotFound());

        verifyNoInteractions(ingestionService);
    }

    @Test
    void testBadDate_BadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/schedule/trips/15-01-2024"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(ingestionService);
    }

    @Test
    void testUpstreamFailure_BadGatewayWithMessage() throws Exception {
        when(ingestionService.ingest(any(), any()))
                .thenThrow(new UpstreamHttpException("Bad schedule for 2024-01-15", 404,
                        "https://gtfs.example/History/2024-01-15/google_transit.zip"));

        mockMvc.perform(get("/api/v1/schedule/stops/2024-01-15"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value(502))
                .andExpect(jsonPath("$.message", containsString("404")));

        verifyNoInteractions(backgroundTaskObserver);
    }

    @Test
    void testMissingServiceDate_BadRequest() throws Exception {
        when(ingestionService.ingest(any(), any())).thenThrow(new MissingServiceDateException(Dataset.TRIPS));

        mockMvc.perform(get("/api/v1/schedule/trips/2024-01-15"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("trips")));
    }

    @Test
    void testIllegalArgumentInFetchPath_InternalServerError() throws Exception {
        when(ingestionService.ingest(any(), any()))
                .thenThrow(new IllegalArgumentException("Illegal character in path at index 8"));

        mockMvc.perform(get("/api/v1/schedule/stops/2024-01-15"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value(500));
    }
}
