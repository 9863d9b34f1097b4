package com.gsesentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of an alarm at a point in its lifecycle.
 *
 * <p>
 * Alarms are owned by the {@link com.gsesentinel.core.alarm.AlarmManager};
 * everything outside it only ever sees these snapshots.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code deviceId}, {@code parameter},
 * {@code severity}, {@code type}, {@code state} and {@code triggeredAt} are
 * required; omitting any of them throws a {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alarm implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long id;
    private final String deviceId;
    private final String parameter;
    private final Severity severity;
    private final AlarmType type;
    private final AlarmState state;
    /** Bound or statistical limit that was crossed; {@code null} for device faults. */
    private final Double thresholdValue;
    private final double actualValue;
    private final Instant triggeredAt;
    private final String acknowledgedBy;
    private final Instant acknowledgedAt;
    private final Instant clearedAt;

    private Alarm(Builder builder) {
        this.id = builder.id;
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId must not be null");
        this.parameter = Objects.requireNonNull(builder.parameter, "parameter must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.state = Objects.requireNonNull(builder.state, "state must not be null");
        this.triggeredAt = Objects.requireNonNull(builder.triggeredAt, "triggeredAt must not be null");
        this.thresholdValue = builder.thresholdValue;
        this.actualValue = builder.actualValue;
        this.acknowledgedBy = builder.acknowledgedBy;
        this.acknowledgedAt = builder.acknowledgedAt;
        this.clearedAt = builder.clearedAt;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alarm} snapshots.
     */
    public static class Builder {
        private long id;
        private String deviceId;
        private String parameter;
        private Severity severity;
        private AlarmType type;
        private AlarmState state = AlarmState.TRIGGERED;
        private Double thresholdValue;
        private double actualValue;
        private Instant triggeredAt;
        private String acknowledgedBy;
        private Instant acknowledgedAt;
        private Instant clearedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder parameter(String parameter) {
            this.parameter = parameter;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder type(AlarmType type) {
            this.type = type;
            return this;
        }

        public Builder state(AlarmState state) {
            this.state = state;
            return this;
        }

        public Builder thresholdValue(Double thresholdValue) {
            this.thresholdValue = thresholdValue;
            return this;
        }

        public Builder actualValue(double actualValue) {
            this.actualValue = actualValue;
            return this;
        }

        public Builder triggeredAt(Instant triggeredAt) {
            this.triggeredAt = triggeredAt;
            return this;
        }

        public Builder acknowledgedBy(String acknowledgedBy) {
            this.acknowledgedBy = acknowledgedBy;
            return this;
        }

        public Builder acknowledgedAt(Instant acknowledgedAt) {
            this.acknowledgedAt = acknowledgedAt;
            return this;
        }

        public Builder clearedAt(Instant clearedAt) {
            this.clearedAt = clearedAt;
            return this;
        }

        public Alarm build() {
            return new Alarm(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public long getId() {
        return id;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getParameter() {
        return parameter;
    }

    public Severity getSeverity() {
        return severity;
    }

    public AlarmType getType() {
        return type;
    }

    public AlarmState getState() {
        return state;
    }

    public Double getThresholdValue() {
        return thresholdValue;
    }

    public double getActualValue() {
        return actualValue;
    }

    public Instant getTriggeredAt() {
        return triggeredAt;
    }

    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public Instant getClearedAt() {
        return clearedAt;
    }

    public boolean isAcknowledged() {
        return acknowledgedAt != null;
    }

    public boolean isCleared() {
        return state == AlarmState.CLEARED;
    }

    /**
     * @return {@code true} while the alarm has not been cleared, whether or not
     *         it was acknowledged
     */
    public boolean isActive() {
        return state != AlarmState.CLEARED;
    }

    /**
     * @return {@code clearedAt - triggeredAt}, or empty while the alarm is
     *         active
     */
    public Optional<Duration> getDuration() {
        return clearedAt == null ? Optional.empty() : Optional.of(Duration.between(triggeredAt, clearedAt));
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alarm alarm))
            return false;
        return id == alarm.id
                && Double.compare(actualValue, alarm.actualValue) == 0
                && state == alarm.state
                && severity == alarm.severity
                && Objects.equals(acknowledgedAt, alarm.acknowledgedAt)
                && Objects.equals(clearedAt, alarm.clearedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, state, severity, actualValue);
    }

    @Override
    public String toString() {
        return "Alarm{" +
                "id=" + id +
                ", deviceId='" + deviceId + '\'' +
                ", parameter='" + parameter + '\'' +
                ", type=" + type +
                ", severity=" + severity +
                ", state=" + state +
                ", thresholdValue=" + thresholdValue +
                ", actualValue=" + actualValue +
                ", triggeredAt=" + triggeredAt +
                '}';
    }
}
