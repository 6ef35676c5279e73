package com.transitlog.backend.service;

import com.google.protobuf.Descriptors;
import com.google.protobuf.UnknownFieldSet;
import com.google.transit.realtime.GtfsRealtime;
import com.google.transit.realtime.GtfsRealtime.EntitySelector;
import com.google.transit.realtime.GtfsRealtime.FeedEntity;
import com.google.transit.realtime.GtfsRealtime.TranslatedString;
import com.google.transit.realtime.GtfsRealtime.VehiclePosition;
import com.transitlog.backend.model.Alert;
import com.transitlog.backend.model.Coordinate;
import com.transitlog.backend.model.Normalized;
import com.transitlog.backend.model.Path;
import com.transitlog.backend.model.Position;
import com.transitlog.backend.model.Route;
import com.transitlog.backend.model.Stop;
import com.transitlog.backend.model.Trip;
import com.transitlog.backend.util.TransitUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns raw realtime entities and schedule rows into domain records.
 *
 * <p>Every record type has one construction function that reads the raw fields
 * one by one and returns a {@link Normalized} result. Entities removed by a
 * filter rule are dropped silently; malformed entities are logged and skipped so
 * the rest of the batch is still delivered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DomainNormalizer {

    // severity_level is field 14 of Alert; older generated bindings keep it as an unknown field
    private static final int SEVERITY_LEVEL_FIELD = 14;
    private static final Map<Long, String> SEVERITY_LEVELS = Map.of(
            1L, "UNKNOWN_SEVERITY",
            2L, "INFO",
            3L, "WARNING",
            4L, "SEVERE");

    private final Clock clock;

    public List<Position> toPositions(List<FeedEntity> entities) {
        return collect("position", entities, this::toPosition);
    }

    public List<Alert> toAlerts(List<FeedEntity> entities) {
        return collect("alert", entities, this::toAlert);
    }

    public List<Trip> toTrips(List<Map<String, String>> rows) {
        return collect("trip", rows, this::toTrip);
    }

    public List<Stop> toStops(List<Map<String, String>> rows) {
        return collect("stop", rows, this::toStop);
    }

    public List<Route> toRoutes(List<Map<String, String>> rows) {
        return collect("route", rows, this::toRoute);
    }

    /**
     * Group shape points into paths. Points arrive sorted by shape id; a path is
     * emitted whenever the id changes, and a terminal row flushes the last one.
     */
    public List<Path> toPaths(List<Map<String, String>> rows) {
        List<Map<String, String>> points = new ArrayList<>(rows);
        points.add(Collections.emptyMap());

        List<Path> paths = new ArrayList<>();
        String id = points.get(0).get("shape_id");
        List<Coordinate> coordinates = new ArrayList<>();

        for (Map<String, String> point : points) {
            String pid = point.get("shape_id");
            if (!Objects.equals(id, pid)) {
                Normalized<Path> path = toPath(id, coordinates);
                path.getRecord().ifPresentOrElse(paths::add,
                        () -> log.warn("⚠️ Skipping malformed path: {}", path.getReason()));
                id = pid;
                coordinates = new ArrayList<>();
            }
            if (pid == null) {
                continue;
            }
            try {
                coordinates.add(Coordinate.of(
                        requireDouble(point, "shape_pt_lon"),
                        requireDouble(point, "shape_pt_lat")));
            } catch (IllegalArgumentException e) {
                log.warn("⚠️ Skipping malformed point of path {}: {}", pid, e.getMessage());
            }
        }

        log.debug("Grouped {} points into {} paths", rows.size(), paths.size());
        return paths;
    }

    public Normalized<Position> toPosition(FeedEntity entity) {
        if (!entity.hasVehicle()) {
            return Normalized.dropped("entity " + entity.getId() + " has no vehicle");
        }
        VehiclePosition raw = entity.getVehicle();
        if (!raw.hasPosition()) {
            return Normalized.rejected("vehicle entity " + entity.getId() + " has no position");
        }

        double longitude = widen(raw.getPosition().getLongitude());
        double latitude = widen(raw.getPosition().getLatitude());
        // Vehicles report (0, 0) until they acquire a fix
        if (longitude == 0 && latitude == 0) {
            return Normalized.dropped("vehicle entity " + entity.getId() + " has no fix");
        }
        if (!raw.hasTimestamp()) {
            return Normalized.rejected("vehicle entity " + entity.getId() + " has no timestamp");
        }

        try {
            GtfsRealtime.TripDescriptor trip = raw.getTrip();
            return Normalized.record(Position.builder()
                    .vehicle(requireId(raw.getVehicle().getId(), "vehicle id"))
                    .trip(requireId(trip.getTripId(), "trip id"))
                    .route(requireId(trip.getRouteId(), "route id"))
                    .direction(trip.getDirectionId())
                    .stop(raw.getCurrentStopSequence())
                    .longitude(longitude)
                    .latitude(latitude)
                    .timestamp(raw.getTimestamp())
                    .date(LocalDate.parse(trip.getStartDate(), DateTimeFormatter.BASIC_ISO_DATE))
                    .build());
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return Normalized.rejected("vehicle entity " + entity.getId() + ": " + e.getMessage());
        }
    }

    public Normalized<Alert> toAlert(FeedEntity entity) {
        if (!entity.hasAlert()) {
            return Normalized.dropped("entity " + entity.getId() + " has no alert");
        }
        GtfsRealtime.Alert raw = entity.getAlert();
        List<EntitySelector> informed = raw.getInformedEntityList();

        // Only alerts that touch at least one bus route are kept
        boolean affectsBuses = informed.stream()
                .anyMatch(e -> e.hasRouteType() && e.getRouteType() == TransitUtils.BUS_ROUTE_TYPE);
        if (!affectsBuses) {
            return Normalized.dropped("alert " + entity.getId() + " does not affect buses");
        }

        Long id = parseId(entity.getId());
        if (id == null) {
            return Normalized.rejected("alert has a non-numeric id: " + entity.getId());
        }

        String text = Stream.of(raw.getHeaderText(), raw.getDescriptionText())
                .map(this::englishText)
                .collect(Collectors.joining(" "))
                .trim();

        long now = clock.instant().getEpochSecond();
        GtfsRealtime.TimeRange period = raw.getActivePeriodCount() > 0 ? raw.getActivePeriod(0) : null;

        return Normalized.record(Alert.builder()
                .id(id)
                .text(text)
                .start(period != null && period.hasStart() ? period.getStart() : now)
                // No end means the alert is still active
                .end(period != null && period.hasEnd() ? period.getEnd() : now)
                .routes(distinctIds(informed, e -> e.hasRouteId() ? e.getRouteId() : null))
                .trips(distinctIds(informed, e -> e.hasTrip() ? e.getTrip().getTripId() : null))
                .stops(distinctIds(informed, e -> e.hasStopId() ? e.getStopId() : null))
                .cause(raw.getCause().name())
                .effect(raw.getEffect().name())
                .severity(severityOf(raw))
                .build());
    }

    public Normalized<Trip> toTrip(Map<String, String> row) {
        String headsign = row.get("trip_headsign");
        if (TransitUtils.isExcludedHeadsign(headsign)) {
            return Normalized.dropped("trip " + row.get("trip_id") + " is not a bus trip");
        }
        try {
            return Normalized.record(Trip.builder()
                    .id(requireLong(row, "trip_id"))
                    .route(requireLong(row, "route_id"))
                    .headsign(headsign == null ? null : headsign.trim())
                    .direction((int) requireLong(row, "direction_id"))
                    .block(requireLong(row, "block_id"))
                    .path(requireLong(row, "shape_id"))
                    .build());
        } catch (IllegalArgumentException e) {
            return Normalized.rejected("trip " + row.get("trip_id") + ": " + e.getMessage());
        }
    }

    public Normalized<Stop> toStop(Map<String, String> row) {
        String zone = row.get("zone_id");
        if (zone == null || !zone.trim().startsWith(TransitUtils.BUS_ZONE_PREFIX)) {
            return Normalized.dropped("stop " + row.get("stop_id") + " is not a bus stop");
        }
        try {
            return Normalized.record(Stop.builder()
                    .id(requireLong(row, "stop_id"))
                    .code(parseId(row.get("stop_code")))
                    .name(trimmed(row.get("stop_name")))
                    .longitude(requireDouble(row, "stop_lon"))
                    .latitude(requireDouble(row, "stop_lat"))
                    .build());
        } catch (IllegalArgumentException e) {
            return Normalized.rejected("stop " + row.get("stop_id") + ": " + e.getMessage());
        }
    }

    public Normalized<Route> toRoute(Map<String, String> row) {
        try {
            if (requireLong(row, "route_type") != TransitUtils.BUS_ROUTE_TYPE) {
                return Normalized.dropped("route " + row.get("route_id") + " is not a bus route");
            }
            String longName = row.get("route_long_name");
            List<String> names = longName == null ? List.of()
                    : Arrays.stream(longName.split("/"))
                            .map(String::trim)
                            .filter(name -> !name.isEmpty())
                            .collect(Collectors.toList());
            return Normalized.record(Route.builder()
                    .id(requireLong(row, "route_id"))
                    .code(trimmed(row.get("route_short_name")))
                    .names(names)
                    .build());
        } catch (IllegalArgumentException e) {
            return Normalized.rejected("route " + row.get("route_id") + ": " + e.getMessage());
        }
    }

    private Normalized<Path> toPath(String id, List<Coordinate> coordinates) {
        Long pathId = parseId(id);
        if (pathId == null) {
            return Normalized.rejected("path has a non-numeric id: " + id);
        }
        if (coordinates.isEmpty()) {
            return Normalized.rejected("path " + id + " has no valid points");
        }
        return Normalized.record(Path.builder()
                .id(pathId)
                .coordinates(coordinates)
                .build());
    }

    private <R, T> List<T> collect(String kind, List<R> raw, Function<R, Normalized<T>> mapper) {
        List<T> records = new ArrayList<>(raw.size());
        int dropped = 0;
        int rejected = 0;
        for (R item : raw) {
            Normalized<T> result;
            try {
                result = mapper.apply(item);
            } catch (RuntimeException e) {
                result = Normalized.rejected(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            switch (result.getOutcome()) {
                case RECORD:
                    result.getRecord().ifPresent(records::add);
                    break;
                case DROPPED:
                    dropped++;
                    break;
                default:
                    rejected++;
                    log.warn("⚠️ Skipping malformed {}: {}", kind, result.getReason());
            }
        }
        log.info("🔄 Normalized {} {} entities: {} kept, {} filtered, {} malformed",
                raw.size(), kind, records.size(), dropped, rejected);
        return records;
    }

    private String englishText(TranslatedString text) {
        return text.getTranslationList().stream()
                .filter(t -> TransitUtils.ENGLISH.equalsIgnoreCase(t.getLanguage()))
                .findFirst()
                .map(TranslatedString.Translation::getText)
                .orElse("");
    }

    private String severityOf(GtfsRealtime.Alert raw) {
        Descriptors.FieldDescriptor field = raw.getDescriptorForType().findFieldByName("severity_level");
        if (field != null) {
            return raw.hasField(field) ? ((Descriptors.EnumValueDescriptor) raw.getField(field)).getName()
                    : SEVERITY_LEVELS.get(1L);
        }
        UnknownFieldSet.Field unknown = raw.getUnknownFields().getField(SEVERITY_LEVEL_FIELD);
        if (unknown.getVarintList().isEmpty()) {
            return SEVERITY_LEVELS.get(1L);
        }
        return SEVERITY_LEVELS.getOrDefault(unknown.getVarintList().get(0), SEVERITY_LEVELS.get(1L));
    }

    /**
     * Distinct positive ids in first-seen order; zero and non-numeric ids are left out.
     */
    private static List<Long> distinctIds(List<EntitySelector> selectors, Function<EntitySelector, String> getter) {
        Set<Long> ids = new LinkedHashSet<>();
        for (EntitySelector selector : selectors) {
            Long id = parseId(getter.apply(selector));
            if (id != null) {
                ids.add(id);
            }
        }
        return new ArrayList<>(ids);
    }

    private static Long parseId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long id = Long.parseLong(value.trim());
            return id != 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long requireId(String value, String name) {
        Long id = parseId(value);
        if (id == null) {
            throw new IllegalArgumentException("invalid " + name + " '" + value + "'");
        }
        return id;
    }

    private static long requireLong(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + column);
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + column + " '" + value + "'");
        }
    }

    private static double requireDouble(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + column);
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + column + " '" + value + "'");
        }
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    // Keeps the short decimal form of the float, e.g. 49.2f becomes 49.2 rather than 49.200000762939453
    private static double widen(float value) {
        return Double.parseDouble(Float.toString(value));
    }
}
