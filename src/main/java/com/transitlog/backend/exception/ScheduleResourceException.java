package com.transitlog.backend.exception;

import java.time.LocalDate;

/**
 * Thrown when a schedule snapshot does not contain a usable table.
 */
public class ScheduleResourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final LocalDate date;
    private final String resource;

    public ScheduleResourceException(LocalDate date, String resource, String message) {
        this(date, resource, message, null);
    }

    public ScheduleResourceException(LocalDate date, String resource, String message, Throwable cause) {
        super("Bad schedule " + resource + " for " + date + ": " + message, cause);
        this.date = date;
        this.resource = resource;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getResource() {
        return resource;
    }
}
