package com.gsesentinel.core.alarm;

import java.util.NoSuchElementException;

/**
 * Thrown when an alarm id does not refer to a known alarm.
 *
 * @since 1.0.0
 */
public class AlarmNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final long alarmId;

    public AlarmNotFoundException(long alarmId) {
        super("Alarm not found: " + alarmId);
        this.alarmId = alarmId;
    }

    public long getAlarmId() {
        return alarmId;
    }
}
