package com.transitlog.backend.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonPropertyOrder({ "id", "code", "names" })
public class Route {
    long id;
    String code;
    // Terminus names, e.g. "Downtown/UBC" becomes two entries
    @Singular
    List<String> names;
}
