package com.transitlog.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.transitlog.backend.util.TransitUtils;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Road geometry followed by one or more trips.
 */
@Value
@Builder
@JsonPropertyOrder({ "id", "location" })
public class Path {
    long id;
    @JsonIgnore
    @Singular
    List<Coordinate> coordinates;

    public String getLocation() {
        return TransitUtils.toLineString(coordinates);
    }
}
