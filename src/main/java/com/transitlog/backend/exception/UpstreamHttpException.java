package com.transitlog.backend.exception;

/**
 * Thrown when an upstream service answers with a non-2xx status.
 * Carries the status and the url or date the request was made for.
 */
public class UpstreamHttpException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final String target;

    public UpstreamHttpException(String message, int status, String target) {
        super(message + ": " + status + " (" + target + ")");
        this.status = status;
        this.target = target;
    }

    public int getStatus() {
        return status;
    }

    public String getTarget() {
        return target;
    }
}
