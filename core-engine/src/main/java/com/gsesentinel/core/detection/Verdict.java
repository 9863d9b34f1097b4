package com.gsesentinel.core.detection;

import com.gsesentinel.core.model.AlarmType;
import com.gsesentinel.core.model.Severity;

import java.util.Objects;

/**
 * Outcome of classifying one telemetry sample: either a violation of a given
 * alarm type and severity, or clean.
 *
 * @since 1.0.0
 */
public final class Verdict {

    private static final Verdict CLEAN = new Verdict(null, Severity.NOMINAL, null, "No anomaly");

    private final AlarmType alarmType;
    private final Severity severity;
    private final Double thresholdValue;
    private final String details;

    private Verdict(AlarmType alarmType, Severity severity, Double thresholdValue, String details) {
        this.alarmType = alarmType;
        this.severity = severity;
        this.thresholdValue = thresholdValue;
        this.details = details;
    }

    /**
     * @param alarmType      kind of violation; must not be {@code null}
     * @param severity       severity; must not be {@code null}
     * @param thresholdValue limit that was crossed
     * @param details        human-readable description
     * @return a violation verdict
     */
    public static Verdict violation(AlarmType alarmType, Severity severity, double thresholdValue,
            String details) {
        return new Verdict(Objects.requireNonNull(alarmType, "alarmType must not be null"),
                Objects.requireNonNull(severity, "severity must not be null"),
                thresholdValue, details);
    }

    /**
     * @return the shared clean verdict
     */
    public static Verdict clean() {
        return CLEAN;
    }

    public boolean isViolation() {
        return alarmType != null;
    }

    /**
     * @return the alarm type, or {@code null} for a clean verdict
     */
    public AlarmType getAlarmType() {
        return alarmType;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return the crossed limit, or {@code null} for a clean verdict
     */
    public Double getThresholdValue() {
        return thresholdValue;
    }

    public String getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return isViolation()
                ? "Verdict{" + alarmType + "/" + severity + ", threshold=" + thresholdValue + '}'
                : "Verdict{CLEAN}";
    }
}
