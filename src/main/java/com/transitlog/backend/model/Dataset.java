package com.transitlog.backend.model;

import com.transitlog.backend.exception.UnknownDatasetException;

import java.util.Arrays;

/**
 * The kinds of records the pipeline produces and where each one comes from.
 */
public enum Dataset {
    POSITIONS("positions", Source.REALTIME, "gtfsposition"),
    ALERTS("alerts", Source.REALTIME, "gtfsalerts"),
    TRIPS("trips", Source.SCHEDULE, "trips.txt"),
    STOPS("stops", Source.SCHEDULE, "stops.txt"),
    ROUTES("routes", Source.SCHEDULE, "routes.txt"),
    PATHS("paths", Source.SCHEDULE, "shapes.txt");

    public enum Source {
        REALTIME, SCHEDULE
    }

    private final String name;
    private final Source source;
    private final String resource;

    Dataset(String name, Source source, String resource) {
        this.name = name;
        this.source = source;
        this.resource = resource;
    }

    public String getName() {
        return name;
    }

    public Source getSource() {
        return source;
    }

    /**
     * Feed resource name for realtime datasets, archive member name for schedule datasets.
     */
    public String getResource() {
        return resource;
    }

    public boolean isRealtime() {
        return source == Source.REALTIME;
    }

    public static Dataset fromName(String name) {
        return Arrays.stream(values())
                .filter(d -> d.name.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new UnknownDatasetException(name));
    }
}
