package com.transitlog.backend.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class Coordinate {
    double longitude;
    double latitude;
}
