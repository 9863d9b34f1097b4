package com.gsesentinel.core.device;

import com.gsesentinel.core.event.MonitorEvent;
import com.gsesentinel.core.model.DeviceMode;
import com.gsesentinel.core.model.DeviceState;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.OperationalStatus;
import com.gsesentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * Owns each device's operating mode and operational status.
 *
 * <h3>Status rules</h3>
 * <ul>
 * <li>In {@link DeviceMode#EMERGENCY_SHUTDOWN} the status is always
 * {@link OperationalStatus#SHUTDOWN}.</li>
 * <li>Any active FAULT or CRITICAL alarm escalates the status to FAULT.</li>
 * <li>Active WARNING alarms give WARNING, except that a FAULT status is held
 * until no alarm of WARNING or above remains. The held status survives an
 * emergency shutdown, so recovery comes back as FAULT in that case.</li>
 * <li>No active alarm of WARNING or above gives NOMINAL.</li>
 * </ul>
 *
 * <p>
 * Modes change only through admitted commands. Each device carries a lock
 * that callers hold across read-decide-mutate sequences.
 * </p>
 *
 * @since 1.0.0
 */
public class DeviceStateTracker {

    private static final Logger LOG = LoggerFactory.getLogger(DeviceStateTracker.class);

    private final Clock clock;
    private final Map<String, DeviceRecord> devices = new ConcurrentHashMap<>();

    public DeviceStateTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    // ---------------------------------------------------------------
    // Registration & queries
    // ---------------------------------------------------------------

    /**
     * Register a device in STANDBY / NOMINAL.
     *
     * @param deviceId device identifier; must not be {@code null} or blank
     * @param type     device type; must not be {@code null}
     * @throws IllegalStateException if the id is already registered
     */
    public void register(String deviceId, DeviceType type) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        Objects.requireNonNull(type, "DeviceType must not be null");
        if (deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId must not be blank");
        }
        if (devices.putIfAbsent(deviceId, new DeviceRecord(deviceId, type)) != null) {
            throw new IllegalStateException("Device already registered: " + deviceId);
        }
        LOG.info("Registered device {} ({})", deviceId, type.getCode());
    }

    /**
     * @param deviceId device identifier
     * @return the device's type, or empty if it is not registered
     */
    public Optional<DeviceType> typeOf(String deviceId) {
        DeviceRecord record = deviceId == null ? null : devices.get(deviceId);
        return record == null ? Optional.empty() : Optional.of(record.deviceType());
    }

    /**
     * @param deviceId device identifier
     * @return snapshot of the device's state
     * @throws UnknownDeviceException if the device is not registered
     */
    public DeviceState state(String deviceId) {
        return require(deviceId).snapshot();
    }

    /**
     * @return snapshots of every registered device, ordered by id
     */
    public List<DeviceState> states() {
        return devices.values().stream()
                .map(DeviceRecord::snapshot)
                .sorted(Comparator.comparing(DeviceState::getDeviceId))
                .toList();
    }

    /**
     * @param deviceId device identifier
     * @return the lock serializing work on this device
     * @throws UnknownDeviceException if the device is not registered
     */
    public Lock lockFor(String deviceId) {
        return require(deviceId).lock();
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Record an admitted command and, for mode-setting commands, switch mode.
     * The status is re-derived afterwards.
     *
     * @param deviceId       device identifier
     * @param command        wire code of the admitted command
     * @param newMode        mode to enter, or {@code null} to keep the current
     *                       one
     * @param highestActive  highest active alarm severity on the device
     * @param events         receives a DEVICE_STATE_CHANGED event if mode or
     *                       status changed
     * @throws UnknownDeviceException if the device is not registered
     */
    public void applyCommand(String deviceId, String command, DeviceMode newMode,
            Optional<Severity> highestActive, List<MonitorEvent> events) {
        DeviceRecord record = require(deviceId);
        Instant now = clock.instant();
        DeviceState before = record.snapshot();

        DeviceMode mode = newMode != null ? newMode : record.mode();
        record.set(mode, deriveStatus(mode, record.alarmStatus(), highestActive),
                alarmStatus(record.alarmStatus(), highestActive));
        record.recordCommand(command, now);

        emitIfChanged(before, record.snapshot(), "command " + command, now, events);
    }

    /**
     * Re-derive the status from the device's current alarms.
     *
     * @param deviceId      device identifier
     * @param highestActive highest active alarm severity on the device
     * @param events        receives a DEVICE_STATE_CHANGED event if the status
     *                      changed
     * @throws UnknownDeviceException if the device is not registered
     */
    public void refreshStatus(String deviceId, Optional<Severity> highestActive, List<MonitorEvent> events) {
        DeviceRecord record = require(deviceId);
        DeviceState before = record.snapshot();
        DeviceMode mode = record.mode();
        record.set(mode, deriveStatus(mode, record.alarmStatus(), highestActive),
                alarmStatus(record.alarmStatus(), highestActive));
        if (record.status() != before.getStatus()) {
            emitIfChanged(before, record.snapshot(), "alarm " + highestActive.map(Enum::name).orElse("none"),
                    clock.instant(), events);
        }
    }

    /**
     * Compute the operational status implied by a mode, the held alarm status
     * and the highest active alarm severity.
     *
     * @param mode          device mode
     * @param held          status implied by alarms before this change
     * @param highestActive highest active alarm severity, empty if none
     * @return derived status
     */
    static OperationalStatus deriveStatus(DeviceMode mode, OperationalStatus held,
            Optional<Severity> highestActive) {
        OperationalStatus status = alarmStatus(held, highestActive);
        return mode == DeviceMode.EMERGENCY_SHUTDOWN ? OperationalStatus.SHUTDOWN : status;
    }

    private static OperationalStatus alarmStatus(OperationalStatus current, Optional<Severity> highestActive) {
        Severity highest = highestActive.orElse(Severity.NOMINAL);
        if (highest.isAtLeast(Severity.FAULT)) {
            return OperationalStatus.FAULT;
        }
        if (highest.isAtLeast(Severity.WARNING)) {
            return current == OperationalStatus.FAULT ? OperationalStatus.FAULT : OperationalStatus.WARNING;
        }
        return OperationalStatus.NOMINAL;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private DeviceRecord require(String deviceId) {
        DeviceRecord record = deviceId == null ? null : devices.get(deviceId);
        if (record == null) {
            throw new UnknownDeviceException(deviceId);
        }
        return record;
    }

    private static void emitIfChanged(DeviceState before, DeviceState after, String cause, Instant at,
            List<MonitorEvent> events) {
        if (before.getMode() == after.getMode() && before.getStatus() == after.getStatus()) {
            return;
        }
        LOG.info("Device {} state {}/{} -> {}/{} ({})", after.getDeviceId(),
                before.getMode(), before.getStatus(), after.getMode(), after.getStatus(), cause);
        events.add(MonitorEvent.ofStateChange(at, before, after, cause));
    }
}
