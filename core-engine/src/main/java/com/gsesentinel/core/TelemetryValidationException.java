package com.gsesentinel.core;

/**
 * Thrown when a telemetry sample cannot be ingested.
 *
 * @since 1.0.0
 */
public class TelemetryValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /** Machine-readable cause of the rejection. */
    public enum Reason {
        UNKNOWN_DEVICE,
        UNKNOWN_PARAMETER,
        BAD_TIMESTAMP,
        BAD_VALUE
    }

    private final Reason reason;

    public TelemetryValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TelemetryValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
