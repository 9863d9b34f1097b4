package com.gsesentinel.core.model;

/**
 * Lifecycle state of an alarm. {@link #CLEARED} is terminal.
 *
 * @since 1.0.0
 */
public enum AlarmState {
    TRIGGERED,
    ACKNOWLEDGED,
    CLEARED
}
