package com.gsesentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Operating mode of a piece of equipment.
 *
 * @since 1.0.0
 */
public enum DeviceMode {

    STANDBY,
    ACTIVE,
    MAINTENANCE,
    EMERGENCY_SHUTDOWN;

    /**
     * Look up a mode by name, case-insensitively.
     *
     * @param value mode name, may be {@code null}
     * @return the mode, or empty if the value is not a known mode
     */
    public static Optional<DeviceMode> fromName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (DeviceMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
