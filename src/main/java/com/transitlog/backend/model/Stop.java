package com.transitlog.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.transitlog.backend.util.TransitUtils;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({ "id", "code", "name", "location" })
public class Stop {
    long id;
    Long code;
    String name;
    @JsonIgnore
    double longitude;
    @JsonIgnore
    double latitude;

    public String getLocation() {
        return TransitUtils.toPoint(longitude, latitude);
    }
}
