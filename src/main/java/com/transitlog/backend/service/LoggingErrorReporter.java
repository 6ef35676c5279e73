package com.transitlog.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reports errors through the application log, tagged with the sink identity so
 * a log-based alert can pick them up.
 */
@Service
@Slf4j
public class LoggingErrorReporter implements ErrorReporter {

    @Value("${errors.sink.name:transitlog-backend}")
    private String sinkName;

    private final AtomicLong reported = new AtomicLong();

    @Override
    public void report(Throwable error, Map<String, String> context) {
        long count = reported.incrementAndGet();
        log.error("🚨 [{}] Background failure #{} {}: {}", sinkName, count, context, error.getMessage(), error);
    }

    public long getReportedCount() {
        return reported.get();
    }
}
