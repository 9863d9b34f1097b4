package com.gsesentinel.core.command;

import com.gsesentinel.core.model.DeviceMode;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decodes the loosely typed parameter map of a command request into the typed
 * {@link CommandParameters} variant of its command type.
 *
 * <p>
 * Numbers may arrive as JSON numbers or numeric strings. Parameters a command
 * does not use are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class CommandParameterDecoder {

    public static final double MIN_VOLTAGE = 20.0;
    public static final double MAX_VOLTAGE = 32.0;
    public static final double MIN_CURRENT_LIMIT = 0.0;
    public static final double MAX_CURRENT_LIMIT = 150.0;
    public static final double MIN_VALVE_POSITION = 0.0;
    public static final double MAX_VALVE_POSITION = 100.0;

    private CommandParameterDecoder() {
    }

    /**
     * @param type       command type
     * @param parameters raw parameters; {@code null} is treated as empty
     * @return typed parameters
     * @throws InvalidCommandParameterException if a required parameter is
     *                                          missing, malformed or out of range
     */
    public static CommandParameters decode(CommandType type, Map<String, Object> parameters) {
        Objects.requireNonNull(type, "CommandType must not be null");
        Map<String, Object> raw = parameters == null ? Map.of() : parameters;
        return switch (type) {
            case SET_MODE -> new CommandParameters.ModeChange(requireMode(raw));
            case SET_VOLTAGE -> new CommandParameters.Voltage(
                    requireNumber(raw, "voltage", MIN_VOLTAGE, MAX_VOLTAGE));
            case SET_CURRENT_LIMIT -> new CommandParameters.CurrentLimit(
                    requireNumber(raw, "current", MIN_CURRENT_LIMIT, MAX_CURRENT_LIMIT));
            case OPEN_VALVE -> new CommandParameters.ValvePosition(
                    requireNumber(raw, "position", MIN_VALVE_POSITION, MAX_VALVE_POSITION));
            default -> CommandParameters.None.INSTANCE;
        };
    }

    private static DeviceMode requireMode(Map<String, Object> raw) {
        Object value = raw.get("mode");
        if (value == null) {
            throw new InvalidCommandParameterException("mode", "Missing required parameter 'mode'");
        }
        Optional<DeviceMode> mode = value instanceof String s ? DeviceMode.fromName(s) : Optional.empty();
        return mode.orElseThrow(() -> new InvalidCommandParameterException("mode",
                "Invalid mode '" + value + "', expected one of STANDBY, ACTIVE, MAINTENANCE, EMERGENCY_SHUTDOWN"));
    }

    private static double requireNumber(Map<String, Object> raw, String field, double min, double max) {
        Object value = raw.get(field);
        if (value == null) {
            throw new InvalidCommandParameterException(field, "Missing required parameter '" + field + "'");
        }
        double number = toDouble(value).orElseThrow(() -> new InvalidCommandParameterException(field,
                "Parameter '" + field + "' must be numeric, got '" + value + "'"));
        if (number < min || number > max) {
            throw new InvalidCommandParameterException(field,
                    "Parameter '" + field + "' must be within [" + min + ", " + max + "], got " + number);
        }
        return number;
    }

    private static Optional<Double> toDouble(Object raw) {
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                value = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }
}
