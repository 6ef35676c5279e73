package com.transitlog.backend.client;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.transit.realtime.GtfsRealtime.FeedMessage;
import com.transitlog.backend.cache.ResponseCache;
import com.transitlog.backend.exception.FeedDecodeException;
import com.transitlog.backend.exception.UpstreamHttpException;
import com.transitlog.backend.model.Alert;
import com.transitlog.backend.model.CachedResponse;
import com.transitlog.backend.model.Dataset;
import com.transitlog.backend.model.Position;
import com.transitlog.backend.service.DomainNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Client for the GTFS-realtime v2 feeds.
 * Responses are cached for as long as the key pool quota requires, so callers can
 * poll freely.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeFeedClient {

    private final CachingHttpClient httpClient;
    private final ApiKeyRotator keyRotator;
    private final DomainNormalizer normalizer;

    @Value("${realtime.api.url:https://gtfs.translink.ca}")
    private String apiUrl;

    /**
     * Fetch and decode one realtime resource.
     *
     * @param resource feed resource name, e.g. gtfsposition
     * @throws UpstreamHttpException if the feed answers with a non-2xx status
     * @throws FeedDecodeException   if the body is not a valid feed message
     */
    public FeedMessage getFeed(String resource) {
        String url = apiUrl + "/v2/" + resource + "?apikey=" + keyRotator.nextKey();
        log.info("📡 Fetching realtime feed: {}", resource);

        CachedResponse response = httpClient.fetch(url, keyRotator.realtimeTtl());
        if (!response.isOk()) {
            throw new UpstreamHttpException("Bad realtime " + resource, response.getStatus(),
                    ResponseCache.cacheKey(url));
        }

        try {
            FeedMessage feed = FeedMessage.parseFrom(response.getBody());
            log.debug("Decoded {} entities from {}", feed.getEntityCount(), resource);
            return feed;
        } catch (InvalidProtocolBufferException e) {
            throw new FeedDecodeException("Bad realtime " + resource + ": " + e.getMessage(), e);
        }
    }

    public List<Position> getPositions() {
        return normalizer.toPositions(getFeed(Dataset.POSITIONS.getResource()).getEntityList());
    }

    public List<Alert> getAlerts() {
        return normalizer.toAlerts(getFeed(Dataset.ALERTS.getResource()).getEntityList());
    }
}
