package com.gsesentinel.core.model;

/**
 * Operational health of a piece of equipment, derived from its active alarms
 * and forced to {@link #SHUTDOWN} while in emergency shutdown.
 *
 * @since 1.0.0
 */
public enum OperationalStatus {
    NOMINAL,
    WARNING,
    FAULT,
    SHUTDOWN
}
