package com.gsesentinel.core.command;

import com.gsesentinel.core.model.DeviceType;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Every command the monitor knows, with the device types that accept it.
 *
 * @since 1.0.0
 */
public enum CommandType {

    SET_MODE("set_mode", DeviceType.GROUND_POWER_UNIT, DeviceType.CRYOGENIC_LINE),
    EMERGENCY_SHUTDOWN("emergency_shutdown", DeviceType.GROUND_POWER_UNIT, DeviceType.CRYOGENIC_LINE),
    CLEAR_FAULT("clear_fault", DeviceType.GROUND_POWER_UNIT, DeviceType.CRYOGENIC_LINE),

    // Ground power unit
    ENABLE_OUTPUT("enable_output", DeviceType.GROUND_POWER_UNIT),
    DISABLE_OUTPUT("disable_output", DeviceType.GROUND_POWER_UNIT),
    SET_VOLTAGE("set_voltage", DeviceType.GROUND_POWER_UNIT),
    SET_CURRENT_LIMIT("set_current_limit", DeviceType.GROUND_POWER_UNIT),
    INJECT_FAULT("inject_fault", DeviceType.GROUND_POWER_UNIT),

    // Cryogenic line
    OPEN_VALVE("open_valve", DeviceType.CRYOGENIC_LINE),
    CLOSE_VALVE("close_valve", DeviceType.CRYOGENIC_LINE),
    INJECT_LEAK("inject_leak", DeviceType.CRYOGENIC_LINE),
    INJECT_VALVE_STUCK("inject_valve_stuck", DeviceType.CRYOGENIC_LINE);

    private final String code;
    private final Set<DeviceType> deviceTypes;

    CommandType(String code, DeviceType first, DeviceType... rest) {
        this.code = code;
        this.deviceTypes = EnumSet.of(first, rest);
    }

    /**
     * @return wire code, e.g. {@code open_valve}
     */
    public String getCode() {
        return code;
    }

    /**
     * @param deviceType device type
     * @return {@code true} if devices of that type accept this command
     */
    public boolean isSupportedBy(DeviceType deviceType) {
        return deviceTypes.contains(deviceType);
    }

    /**
     * @return {@code true} for commands admitted regardless of mode, status,
     *         alarms or interlocks
     */
    public boolean isPriority() {
        return this == EMERGENCY_SHUTDOWN;
    }

    /**
     * @param value wire code, case-insensitive
     * @return the command type, or empty if unknown
     */
    public static Optional<CommandType> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CommandType type : values()) {
            if (type.code.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
