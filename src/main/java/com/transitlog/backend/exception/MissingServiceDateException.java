package com.transitlog.backend.exception;

import com.transitlog.backend.model.Dataset;

public class MissingServiceDateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MissingServiceDateException(Dataset dataset) {
        super("A service date is required for " + dataset.getName());
    }
}
