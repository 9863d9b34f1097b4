package com.gsesentinel.core;

import com.gsesentinel.core.detection.Verdict;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of ingesting one telemetry sample.
 *
 * @since 1.0.0
 */
public final class IngestResult {

    private final String deviceId;
    private final String parameter;
    private final Instant timestamp;
    private final Double value;
    private final Verdict verdict;
    private final TelemetryValidationException.Reason rejectionReason;
    private final String message;

    private IngestResult(String deviceId, String parameter, Instant timestamp, Double value, Verdict verdict,
            TelemetryValidationException.Reason rejectionReason, String message) {
        this.deviceId = deviceId;
        this.parameter = parameter;
        this.timestamp = timestamp;
        this.value = value;
        this.verdict = verdict;
        this.rejectionReason = rejectionReason;
        this.message = message;
    }

    static IngestResult accepted(String deviceId, String parameter, Instant timestamp, double value,
            Verdict verdict) {
        return new IngestResult(deviceId, parameter, timestamp, value,
                Objects.requireNonNull(verdict, "Verdict must not be null"), null, null);
    }

    static IngestResult rejected(String deviceId, String parameter, TelemetryValidationException cause) {
        return new IngestResult(deviceId, parameter, null, null, null, cause.getReason(), cause.getMessage());
    }

    public boolean isAccepted() {
        return rejectionReason == null;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getParameter() {
        return parameter;
    }

    /**
     * @return parsed sample time, {@code null} for rejections
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    public Double getValue() {
        return value;
    }

    /**
     * @return detection outcome, {@code null} for rejections
     */
    public Verdict getVerdict() {
        return verdict;
    }

    public TelemetryValidationException.Reason getRejectionReason() {
        return rejectionReason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isAccepted()
                ? "Accepted{" + deviceId + '/' + parameter + '=' + value + ", " + verdict + '}'
                : "Rejected{" + deviceId + '/' + parameter + ", " + rejectionReason + ": " + message + '}';
    }
}
