package com.gsesentinel.core.device;

import com.gsesentinel.core.model.DeviceMode;
import com.gsesentinel.core.model.DeviceState;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.OperationalStatus;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one device, owned by {@link DeviceStateTracker}.
 */
final class DeviceRecord {

    private final String deviceId;
    private final DeviceType deviceType;

    /** Serializes ingest and command admission for this device. */
    private final ReentrantLock lock = new ReentrantLock();

    private DeviceMode mode = DeviceMode.STANDBY;
    private OperationalStatus status = OperationalStatus.NOMINAL;
    /** Status implied by alarms alone; survives an emergency shutdown. */
    private OperationalStatus alarmStatus = OperationalStatus.NOMINAL;
    private String lastCommand;
    private Instant lastCommandAt;

    DeviceRecord(String deviceId, DeviceType deviceType) {
        this.deviceId = deviceId;
        this.deviceType = deviceType;
    }

    ReentrantLock lock() {
        return lock;
    }

    DeviceType deviceType() {
        return deviceType;
    }

    synchronized DeviceMode mode() {
        return mode;
    }

    synchronized OperationalStatus status() {
        return status;
    }

    synchronized OperationalStatus alarmStatus() {
        return alarmStatus;
    }

    synchronized void set(DeviceMode newMode, OperationalStatus newStatus, OperationalStatus newAlarmStatus) {
        mode = newMode;
        status = newStatus;
        alarmStatus = newAlarmStatus;
    }

    synchronized void recordCommand(String command, Instant at) {
        lastCommand = command;
        lastCommandAt = at;
    }

    synchronized DeviceState snapshot() {
        return new DeviceState(deviceId, deviceType, mode, status, lastCommand, lastCommandAt);
    }
}
