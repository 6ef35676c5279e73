package com.transitlog.backend.exception;

/**
 * Thrown when a fetched payload cannot be decoded, such as a corrupt zip
 * archive or a malformed GTFS-realtime message. No partial result is kept.
 */
public class FeedDecodeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FeedDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
