package com.transitlog.backend.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.transitlog.backend.util.TransitUtils;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A point-in-time observation of a vehicle on the road.
 */
@Value
@Builder
@JsonPropertyOrder({ "id", "vehicle", "trip", "route", "direction", "stop", "longitude", "latitude",
        "location", "timestamp", "date" })
public class Position {
    long vehicle;
    long trip;
    long route;
    int direction;
    // Ordinal of the next stop the vehicle is approaching
    int stop;
    double longitude;
    double latitude;
    // Seconds since epoch when the position was observed
    long timestamp;
    // Service date, which can differ from the timestamp date for late-night trips
    LocalDate date;

    public String getId() {
        return vehicle + "-" + timestamp;
    }

    public String getLocation() {
        return TransitUtils.toPoint(longitude, latitude);
    }
}
