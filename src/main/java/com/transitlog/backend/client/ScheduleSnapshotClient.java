package com.transitlog.backend.client;

import com.transitlog.backend.cache.ResponseCache;
import com.transitlog.backend.exception.ScheduleResourceException;
import com.transitlog.backend.exception.TableParseException;
import com.transitlog.backend.exception.UpstreamHttpException;
import com.transitlog.backend.model.CachedResponse;
import com.transitlog.backend.model.Dataset;
import com.transitlog.backend.model.Path;
import com.transitlog.backend.model.Route;
import com.transitlog.backend.model.Stop;
import com.transitlog.backend.model.Trip;
import com.transitlog.backend.service.DomainNormalizer;
import com.transitlog.backend.util.CsvTables;
import com.transitlog.backend.util.ZipExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Client for the historical static GTFS archives, one zip per service date.
 * Archives never change once published, so they are cached for a long time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleSnapshotClient {

    static final String VERSION_PLACEHOLDER = "{version}";

    private final CachingHttpClient httpClient;
    private final DomainNormalizer normalizer;

    @Value("${schedule.archive.url-pattern:https://translinkweb.blob.core.windows.net/gtfs/History/{version}/google_transit.zip}")
    private String urlPattern;

    @Value("${schedule.archive.ttl-seconds:31449600}")
    private long ttlSeconds;

    /**
     * Read one table of the snapshot published for a date.
     *
     * @param date  service date of the snapshot
     * @param table archive member name, e.g. trips.txt
     * @return the table rows keyed by column name
     * @throws UpstreamHttpException      if the archive cannot be downloaded
     * @throws ScheduleResourceException  if the member is missing or malformed
     */
    public List<Map<String, String>> getSchedule(LocalDate date, String table) {
        String version = date.format(DateTimeFormatter.ISO_LOCAL_DATE);
        String url = urlPattern.replace(VERSION_PLACEHOLDER, version);
        log.info("📦 Fetching schedule {} for {}", table, version);

        CachedResponse response = httpClient.fetch(url, Duration.ofSeconds(ttlSeconds));
        if (!response.isOk()) {
            throw new UpstreamHttpException("Bad schedule for " + version, response.getStatus(),
                    ResponseCache.cacheKey(url));
        }

        Map<String, String> members = ZipExtractor.unzip(response.getBody(), table);
        String text = members.get(table);
        if (text == null) {
            throw new ScheduleResourceException(date, table, "not in archive");
        }

        try {
            List<Map<String, String>> rows = CsvTables.parse(text);
            log.info("✅ Read {} rows from {} ({})", rows.size(), table, version);
            return rows;
        } catch (TableParseException e) {
            throw new ScheduleResourceException(date, table, e.getMessage(), e);
        }
    }

    public List<Trip> getTrips(LocalDate date) {
        return normalizer.toTrips(getSchedule(date, Dataset.TRIPS.getResource()));
    }

    public List<Stop> getStops(LocalDate date) {
        return normalizer.toStops(getSchedule(date, Dataset.STOPS.getResource()));
    }

    public List<Route> getRoutes(LocalDate date) {
        return normalizer.toRoutes(getSchedule(date, Dataset.ROUTES.getResource()));
    }

    public List<Path> getPaths(LocalDate date) {
        return normalizer.toPaths(getSchedule(date, Dataset.PATHS.getResource()));
    }
}
