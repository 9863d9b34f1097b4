package com.gsesentinel.core.model;

/**
 * Classification of the condition that raised an alarm.
 *
 * @since 1.0.0
 */
public enum AlarmType {

    /** Value above the parameter's maximum. */
    THRESHOLD_HIGH,

    /** Value below the parameter's minimum. */
    THRESHOLD_LOW,

    /** Value more than N standard deviations from the rolling mean. */
    STATISTICAL_ANOMALY,

    /** The equipment itself reported a WARNING or worse status for the sample. */
    DEVICE_FAULT
}
