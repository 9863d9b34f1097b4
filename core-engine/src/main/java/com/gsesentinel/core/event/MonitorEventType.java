package com.gsesentinel.core.event;

/**
 * Kinds of events the core emits to its event sink.
 *
 * @since 1.0.0
 */
public enum MonitorEventType {
    ALARM_TRIGGERED,
    ALARM_UPDATED,
    ALARM_ACKNOWLEDGED,
    ALARM_CLEARED,
    DEVICE_STATE_CHANGED,
    COMMAND_ADMITTED,
    COMMAND_REJECTED,
    COMMAND_COMPLETED
}
