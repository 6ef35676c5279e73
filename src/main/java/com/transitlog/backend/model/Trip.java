package com.transitlog.backend.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({ "id", "route", "headsign", "direction", "block", "path" })
public class Trip {
    long id;
    long route;
    String headsign;
    int direction;
    // Groups the trips a single vehicle runs in a day
    long block;
    long path;
}
