package com.gsesentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies one telemetry series: a (device, parameter) pair.
 *
 * @since 1.0.0
 */
public final class SeriesKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String deviceId;
    private final String parameter;

    public SeriesKey(String deviceId, String parameter) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        this.parameter = Objects.requireNonNull(parameter, "parameter must not be null");
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getParameter() {
        return parameter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return deviceId.equals(that.deviceId) && parameter.equals(that.parameter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, parameter);
    }

    @Override
    public String toString() {
        return deviceId + "/" + parameter;
    }
}
