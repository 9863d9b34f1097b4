package com.gsesentinel.core.device;

import java.util.NoSuchElementException;

/**
 * Thrown when a device id is not registered with the monitor.
 *
 * @since 1.0.0
 */
public class UnknownDeviceException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final String deviceId;

    public UnknownDeviceException(String deviceId) {
        super("Unknown device: " + deviceId);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
