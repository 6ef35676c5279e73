package com.transitlog.backend;

import com.amazonaws.serverless.exceptions.ContainerInitializationException;
import com.amazonaws.serverless.proxy.model.AwsProxyRequest;
import com.amazonaws.serverless.proxy.model.AwsProxyResponse;
import com.amazonaws.serverless.proxy.spring.SpringBootLambdaContainerHandler;
import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.transitlog.backend.config.ApplicationContextHolder;
import com.transitlog.backend.model.IngestionResult;
import com.transitlog.backend.model.WriteReport;
import com.transitlog.backend.service.BackgroundTaskObserver;
import com.transitlog.backend.service.IngestionService;
import com.transitlog.backend.service.PendingWrites;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class StreamLambdaHandler implements RequestStreamHandler {
    private static SpringBootLambdaContainerHandler<AwsProxyRequest, AwsProxyResponse> handler;

    static {
        try {
            handler = SpringBootLambdaContainerHandler.getAwsProxyHandler(TransitlogApplication.class);
        } catch (ContainerInitializationException e) {
            // if we fail here. We re-throw the exception to force another cold start
            throw new IllegalStateException("Could not initialize Spring Boot application", e);
        }
    }

    @Override
    public void handleRequest(InputStream inputStream, OutputStream outputStream, Context context)
            throws IOException {

        byte[] inputBytes = inputStream.readAllBytes();
        String inputString = new String(inputBytes, StandardCharsets.UTF_8);

        // Check if this is an AWS EventBridge Scheduled Event
        if (isScheduledEvent(inputString)) {
            context.getLogger().log("⏰ Detected EventBridge Scheduled Event. Ingesting realtime feeds...");
            IngestionService ingestionService = ApplicationContextHolder.getBean(IngestionService.class);
            BackgroundTaskObserver observer = ApplicationContextHolder.getBean(BackgroundTaskObserver.class);

            List<IngestionResult<?>> results = ingestionService.ingestRealtime();
            // The function may be frozen once we return, so wait for the writes
            for (IngestionResult<?> result : results) {
                WriteReport report = observer.observe(result).join();
                context.getLogger().log(String.format("✅ %s: %d records, targets %s",
                        result.getDataset().getName(), result.getRecords().size(), report.getResults()));
            }
            return;
        }

        // Otherwise, proceed with normal API Proxy (Rest Controllers)
        handler.proxyStream(new ByteArrayInputStream(inputBytes), outputStream, context);

        // Writes started by the request outlive it; the function may be frozen once we return
        int awaited = ApplicationContextHolder.getBean(PendingWrites.class).awaitAll();
        if (awaited > 0) {
            context.getLogger().log(String.format("✅ Finished %d background write(s)", awaited));
        }
    }

    static boolean isScheduledEvent(String input) {
        return input.contains("aws.events") && input.contains("Scheduled Event");
    }
}
