package com.transitlog.backend.scheduler;

import com.transitlog.backend.model.IngestionResult;
import com.transitlog.backend.service.BackgroundTaskObserver;
import com.transitlog.backend.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Profile("!lambda")
@ConditionalOnProperty(name = "ingest.realtime.scheduled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RealtimeIngestionScheduler {

    private final IngestionService ingestionService;
    private final BackgroundTaskObserver backgroundTaskObserver;

    /**
     * Ingest positions and alerts on the configured interval
     */
    @Scheduled(fixedRateString = "${ingest.realtime.interval:60000}", initialDelayString = "${ingest.realtime.interval:60000}")
    public void pollAndStore() {
        for (IngestionResult<?> result : ingestionService.ingestRealtime()) {
            backgroundTaskObserver.observe(result);
        }
    }
}
