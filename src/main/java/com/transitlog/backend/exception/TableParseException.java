package com.transitlog.backend.exception;

import java.util.List;

/**
 * Thrown when delimited text contains malformed rows.
 * Every row error is collected before this is raised.
 */
public class TableParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public TableParseException(List<String> errors) {
        super("Malformed table with " + errors.size() + " error(s): " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
