package com.transitlog.backend.service;

import com.transitlog.backend.exception.StorageWriteException;
import com.transitlog.backend.model.Dataset;
import com.transitlog.backend.model.IngestionResult;
import com.transitlog.backend.model.WriteReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BackgroundTaskObserverTest {

    @Mock
    private ErrorReporter errorReporter;

    private PendingWrites pendingWrites;
    private BackgroundTaskObserver observer;

    @BeforeEach
    void setUp() {
        pendingWrites = new PendingWrites();
        observer = new BackgroundTaskObserver(errorReporter, pendingWrites);
    }

    @Test
    void testObserve_TargetFailure_Reported() {
        // Given
        StorageWriteException failure = new StorageWriteException("warehouse", 401, "Unauthorized");
        CompletableFuture<WriteReport> writes = new CompletableFuture<>();
        IngestionResult<String> result = new IngestionResult<>(Dataset.POSITIONS, List.of("p"), writes);

        // When
        CompletableFuture<WriteReport> observed = observer.observe(result);
        writes.complete(WriteReport.builder()
                .dataset(Dataset.POSITIONS)
                .records(1)
                .result("object-store", true)
                .result("warehouse", false)
                .failure("warehouse", failure)
                .build());

        // Then
        assertFalse(observed.join().isSuccessful());
        verify(errorReporter).report(eq(failure),
                eq(Map.of("dataset", "positions", "stage", "write", "target", "warehouse")));
        verifyNoMoreInteractions(errorReporter);
    }

    @Test
    void testObserve_AllWritten_NothingReported() {
        CompletableFuture<WriteReport> writes = CompletableFuture.completedFuture(WriteReport.builder()
                .dataset(Dataset.TRIPS)
                .records(2)
                .result("object-store", true)
                .build());

        observer.observe(new IngestionResult<>(Dataset.TRIPS, List.of("a", "b"), writes)).join();

        verify(errorReporter, never()).report(any(), anyMap());
    }

    @Test
    void testObserve_ExceptionalHandle_Reported() {
        CompletableFuture<WriteReport> writes = CompletableFuture.failedFuture(new IllegalStateException("boom"));

        observer.observe(new IngestionResult<>(Dataset.ALERTS, List.of(), writes));

        verify(errorReporter).report(any(IllegalStateException.class), eq(Map.of("dataset", "alerts", "stage", "write")));
    }

    @Test
    void testObserve_TracksWriteUntilComplete() {
        // Given
        CompletableFuture<WriteReport> writes = new CompletableFuture<>();

        // When
        observer.observe(new IngestionResult<>(Dataset.STOPS, List.of("s"), writes));

        // Then
        assertEquals(1, pendingWrites.size());
        writes.complete(WriteReport.builder().dataset(Dataset.STOPS).records(1).result("object-store", true).build());
        assertEquals(0, pendingWrites.size());
    }
}
