package com.transitlog.backend.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A public notice about a service disruption affecting bus service.
 */
@Value
@Builder
@JsonPropertyOrder({ "id", "text", "start", "end", "routes", "trips", "stops", "cause", "effect", "severity" })
public class Alert {
    long id;
    String text;
    long start;
    // Alerts that are still active carry the time they were last seen
    long end;
    @Singular
    List<Long> routes;
    @Singular
    List<Long> trips;
    @Singular
    List<Long> stops;
    String cause;
    String effect;
    String severity;
}
