package com.transitlog.backend.exception;

/**
 * Thrown when a storage target rejects a batch of records.
 */
public class StorageWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final String body;

    public StorageWriteException(String target, int status, String body) {
        this(target, status, body, null);
    }

    public StorageWriteException(String target, int status, String body, Throwable cause) {
        super(target + " rejected write with " + status + ": " + body, cause);
        this.status = status;
        this.body = body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }
}
