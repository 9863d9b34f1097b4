package com.gsesentinel.core.alarm;

import com.gsesentinel.core.model.Alarm;
import com.gsesentinel.core.model.AlarmState;
import com.gsesentinel.core.model.Severity;

import java.time.Instant;

/**
 * Mutable alarm owned by {@link AlarmManager}. Never leaves the package;
 * callers receive {@link Alarm} snapshots.
 */
final class AlarmRecord {

    private final long id;
    private final AlarmKey key;
    private final Instant triggeredAt;

    private Severity severity;
    private Double thresholdValue;
    private double actualValue;
    private AlarmState state = AlarmState.TRIGGERED;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private Instant clearedAt;

    AlarmRecord(long id, AlarmKey key, Severity severity, Double thresholdValue, double actualValue,
            Instant triggeredAt) {
        this.id = id;
        this.key = key;
        this.severity = severity;
        this.thresholdValue = thresholdValue;
        this.actualValue = actualValue;
        this.triggeredAt = triggeredAt;
    }

    long id() {
        return id;
    }

    AlarmKey key() {
        return key;
    }

    synchronized Severity severity() {
        return severity;
    }

    synchronized boolean isActive() {
        return state != AlarmState.CLEARED;
    }

    /**
     * Apply a repeat violation in place.
     *
     * @return {@code true} if the severity changed
     */
    synchronized boolean update(Severity newSeverity, Double newThreshold, double newValue) {
        boolean changed = severity != newSeverity;
        severity = newSeverity;
        thresholdValue = newThreshold;
        actualValue = newValue;
        return changed;
    }

    /**
     * @return {@code true} if this call recorded the acknowledgment
     */
    synchronized boolean acknowledge(String operator, Instant at) {
        if (acknowledgedAt != null) {
            return false;
        }
        acknowledgedBy = operator;
        acknowledgedAt = at;
        if (state == AlarmState.TRIGGERED) {
            state = AlarmState.ACKNOWLEDGED;
        }
        return true;
    }

    /**
     * Move to CLEARED. The clear time never precedes the trigger time.
     */
    synchronized void clear(Instant at) {
        clearedAt = at.isBefore(triggeredAt) ? triggeredAt : at;
        state = AlarmState.CLEARED;
    }

    synchronized Alarm snapshot() {
        return Alarm.builder()
                .id(id)
                .deviceId(key.deviceId())
                .parameter(key.parameter())
                .type(key.type())
                .severity(severity)
                .state(state)
                .thresholdValue(thresholdValue)
                .actualValue(actualValue)
                .triggeredAt(triggeredAt)
                .acknowledgedBy(acknowledgedBy)
                .acknowledgedAt(acknowledgedAt)
                .clearedAt(clearedAt)
                .build();
    }
}
