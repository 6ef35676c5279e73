package com.transitlog.backend.model;

import java.util.Optional;

/**
 * Result of turning one raw upstream entity into a domain record.
 * A record is either produced, dropped by a filter rule, or rejected as malformed.
 */
public final class Normalized<T> {

    public enum Outcome {
        RECORD, DROPPED, REJECTED
    }

    private final Outcome outcome;
    private final T record;
    private final String reason;

    private Normalized(Outcome outcome, T record, String reason) {
        this.outcome = outcome;
        this.record = record;
        this.reason = reason;
    }

    public static <T> Normalized<T> record(T record) {
        return new Normalized<>(Outcome.RECORD, record, null);
    }

    public static <T> Normalized<T> dropped(String reason) {
        return new Normalized<>(Outcome.DROPPED, null, reason);
    }

    public static <T> Normalized<T> rejected(String reason) {
        return new Normalized<>(Outcome.REJECTED, null, reason);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Optional<T> getRecord() {
        return Optional.ofNullable(record);
    }

    public String getReason() {
        return reason;
    }

    public boolean isRecord() {
        return outcome == Outcome.RECORD;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED;
    }

    @Override
    public String toString() {
        return outcome == Outcome.RECORD ? "Normalized[" + record + "]" : "Normalized[" + outcome + ": " + reason + "]";
    }
}
