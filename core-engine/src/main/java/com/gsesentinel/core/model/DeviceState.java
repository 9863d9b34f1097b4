package com.gsesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one device's mode and operational status.
 *
 * @since 1.0.0
 */
public final class DeviceState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String deviceId;
    private final DeviceType deviceType;
    private final DeviceMode mode;
    private final OperationalStatus status;
    private final String lastCommand;
    private final Instant lastCommandAt;

    public DeviceState(String deviceId, DeviceType deviceType, DeviceMode mode, OperationalStatus status,
            String lastCommand, Instant lastCommandAt) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        this.deviceType = Objects.requireNonNull(deviceType, "deviceType must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.lastCommand = lastCommand;
        this.lastCommandAt = lastCommandAt;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public DeviceType getDeviceType() {
        return deviceType;
    }

    public DeviceMode getMode() {
        return mode;
    }

    public OperationalStatus getStatus() {
        return status;
    }

    /**
     * @return wire code of the last admitted command, or {@code null} if none
     */
    public String getLastCommand() {
        return lastCommand;
    }

    public Instant getLastCommandAt() {
        return lastCommandAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeviceState that))
            return false;
        return deviceId.equals(that.deviceId)
                && deviceType == that.deviceType
                && mode == that.mode
                && status == that.status
                && Objects.equals(lastCommand, that.lastCommand)
                && Objects.equals(lastCommandAt, that.lastCommandAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, deviceType, mode, status, lastCommand, lastCommandAt);
    }

    @Override
    public String toString() {
        return "DeviceState{" +
                "deviceId='" + deviceId + '\'' +
                ", deviceType=" + deviceType +
                ", mode=" + mode +
                ", status=" + status +
                ", lastCommand='" + lastCommand + '\'' +
                ", lastCommandAt=" + lastCommandAt +
                '}';
    }
}
