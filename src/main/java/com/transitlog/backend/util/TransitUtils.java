package com.transitlog.backend.util;

import com.transitlog.backend.model.Coordinate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class TransitUtils {

    // GTFS route_type ordinal for bus service
    public static final int BUS_ROUTE_TYPE = 3;

    // Stops served by buses carry a zone id such as "BUS ZN"
    public static final String BUS_ZONE_PREFIX = "BUS";

    // Rapid transit, ferry and commuter rail lines published in the same schedule
    public static final Set<String> EXCLUDED_HEADSIGNS = Set.of(
            "CANADA LINE",
            "EXPO LINE",
            "MILLENNIUM LINE",
            "SEABUS",
            "WEST COAST EXPRESS");

    public static final String ENGLISH = "en";

    private TransitUtils() {
    }

    public static boolean isExcludedHeadsign(String headsign) {
        if (headsign == null || headsign.isBlank()) {
            return false;
        }
        String normalized = headsign.trim().toUpperCase();
        return EXCLUDED_HEADSIGNS.stream().anyMatch(normalized::startsWith);
    }

    /**
     * Well-known text for a single point, longitude first.
     */
    public static String toPoint(double longitude, double latitude) {
        return "POINT(" + format(longitude) + " " + format(latitude) + ")";
    }

    /**
     * Well-known text for an ordered list of points, longitude first.
     */
    public static String toLineString(List<Coordinate> coordinates) {
        return coordinates.stream()
                .map(c -> format(c.getLongitude()) + " " + format(c.getLatitude()))
                .collect(Collectors.joining(", ", "LINESTRING(", ")"));
    }

    private static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
