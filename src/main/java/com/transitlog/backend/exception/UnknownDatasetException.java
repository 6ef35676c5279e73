package com.transitlog.backend.exception;

public class UnknownDatasetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnknownDatasetException(String name) {
        super("Unknown dataset: " + name);
    }
}
