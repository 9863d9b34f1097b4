package com.gsesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One raw telemetry sample as delivered by the transport layer.
 *
 * <p>
 * The timestamp is kept as the raw string received so that a malformed value
 * can be rejected per point instead of failing the whole message. The
 * optional {@code status} is the severity the equipment itself attached to the
 * sample; it defaults to {@link Severity#NOMINAL}.
 * </p>
 *
 * <p>
 * JSON field names follow the equipment wire format ({@code device_id},
 * {@code parameter}, {@code timestamp}, {@code value}, {@code status}); any
 * other fields ({@code unit}, {@code device_type}) are ignored.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TelemetryPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String deviceId;
    private final String parameter;
    private final String timestamp;
    private final Double value;
    private final Severity reportedStatus;

    @JsonCreator
    public TelemetryPoint(@JsonProperty("device_id") String deviceId,
            @JsonProperty("parameter") String parameter,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("value") Double value,
            @JsonProperty("status") String status) {
        this(deviceId, parameter, timestamp, value, Severity.parse(status));
    }

    public TelemetryPoint(String deviceId, String parameter, String timestamp, Double value,
            Severity reportedStatus) {
        this.deviceId = deviceId;
        this.parameter = parameter;
        this.timestamp = timestamp;
        this.value = value;
        this.reportedStatus = reportedStatus != null ? reportedStatus : Severity.NOMINAL;
    }

    /**
     * Convenience factory for a sample without a device-reported status.
     */
    public static TelemetryPoint of(String deviceId, String parameter, String timestamp, double value) {
        return new TelemetryPoint(deviceId, parameter, timestamp, value, Severity.NOMINAL);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getParameter() {
        return parameter;
    }

    public String getTimestamp() {
        return timestamp;
    }

    /**
     * @return the sample value, or {@code null} if the message carried none
     */
    public Double getValue() {
        return value;
    }

    public Severity getReportedStatus() {
        return reportedStatus;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryPoint that))
            return false;
        return Objects.equals(deviceId, that.deviceId)
                && Objects.equals(parameter, that.parameter)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(value, that.value)
                && reportedStatus == that.reportedStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, parameter, timestamp, value, reportedStatus);
    }

    @Override
    public String toString() {
        return "TelemetryPoint{" +
                "deviceId='" + deviceId + '\'' +
                ", parameter='" + parameter + '\'' +
                ", timestamp='" + timestamp + '\'' +
                ", value=" + value +
                ", reportedStatus=" + reportedStatus +
                '}';
    }
}
