package com.gsesentinel.core.alarm;

import com.gsesentinel.core.model.AlarmType;

import java.util.Objects;

/**
 * The (device, parameter, alarm type) tuple under which at most one alarm may
 * be active.
 */
final class AlarmKey {

    private final String deviceId;
    private final String parameter;
    private final AlarmType type;

    AlarmKey(String deviceId, String parameter, AlarmType type) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        this.parameter = Objects.requireNonNull(parameter, "parameter must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    String deviceId() {
        return deviceId;
    }

    String parameter() {
        return parameter;
    }

    AlarmType type() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlarmKey that))
            return false;
        return deviceId.equals(that.deviceId) && parameter.equals(that.parameter) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, parameter, type);
    }

    @Override
    public String toString() {
        return deviceId + "/" + parameter + "/" + type;
    }
}
