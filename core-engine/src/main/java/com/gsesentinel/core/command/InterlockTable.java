package com.gsesentinel.core.command;

import com.gsesentinel.core.model.DeviceMode;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.OperationalStatus;
import com.gsesentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative table of interlocks, keyed by device type and command type.
 * Rules for a pair are evaluated in registration order; the first violation
 * wins.
 *
 * @since 1.0.0
 */
public final class InterlockTable {

    /** Valve operations need the line chilled below this temperature (°C). */
    public static final double CRYO_VALVE_MAX_TEMPERATURE = -100.0;

    static final Interlock NO_CRITICAL_ALARM = Interlock.require("no-critical-alarm",
            ctx -> !ctx.hasActiveAlarmAtLeast(Severity.CRITICAL),
            ctx -> "Device " + ctx.getState().getDeviceId() + " has an active CRITICAL alarm");

    private final Map<DeviceType, Map<CommandType, List<Interlock>>> rules;

    private InterlockTable(Map<DeviceType, Map<CommandType, List<Interlock>>> rules) {
        this.rules = rules;
    }

    /**
     * @return the interlocks for the ground power unit and cryogenic line
     */
    public static InterlockTable standard() {
        return builder()
                .rule(DeviceType.GROUND_POWER_UNIT, CommandType.ENABLE_OUTPUT, Interlock.require("mode-active",
                        ctx -> ctx.getState().getMode() == DeviceMode.ACTIVE,
                        ctx -> "Output can only be enabled in ACTIVE mode, device is "
                                + ctx.getState().getMode()))
                .rule(DeviceType.GROUND_POWER_UNIT, CommandType.ENABLE_OUTPUT, Interlock.require("not-faulted",
                        ctx -> ctx.getState().getStatus() != OperationalStatus.FAULT,
                        ctx -> "Output cannot be enabled while the device is in FAULT"))
                .rule(DeviceType.GROUND_POWER_UNIT, CommandType.ENABLE_OUTPUT, NO_CRITICAL_ALARM)
                .rule(DeviceType.CRYOGENIC_LINE, CommandType.OPEN_VALVE, Interlock.require("line-chilled",
                        ctx -> ctx.latest("temperature").map(t -> t < CRYO_VALVE_MAX_TEMPERATURE).orElse(false),
                        ctx -> ctx.latest("temperature")
                                .map(t -> "Temperature too high for valve operation: " + t
                                        + " °C, must be below " + CRYO_VALVE_MAX_TEMPERATURE + " °C")
                                .orElse("No temperature reading, valve operation requires temperature below "
                                        + CRYO_VALVE_MAX_TEMPERATURE + " °C")))
                .rule(DeviceType.CRYOGENIC_LINE, CommandType.OPEN_VALVE, NO_CRITICAL_ALARM)
                .build();
    }

    /**
     * @return an empty table builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param deviceType  device type
     * @param commandType command type
     * @return the interlocks gating the pair, empty if the command is ungated
     */
    public List<Interlock> rulesFor(DeviceType deviceType, CommandType commandType) {
        return rules.getOrDefault(deviceType, Map.of()).getOrDefault(commandType, List.of());
    }

    /**
     * Evaluate every rule for the pair in order.
     *
     * @return the first violated interlock and its message, or empty
     */
    public Optional<Violation> check(DeviceType deviceType, CommandType commandType, InterlockContext context) {
        for (Interlock interlock : rulesFor(deviceType, commandType)) {
            Optional<String> message = interlock.check(context);
            if (message.isPresent()) {
                return Optional.of(new Violation(interlock, message.get()));
            }
        }
        return Optional.empty();
    }

    /** A failed interlock together with its message. */
    public static final class Violation {

        private final Interlock interlock;
        private final String message;

        Violation(Interlock interlock, String message) {
            this.interlock = interlock;
            this.message = message;
        }

        public Interlock getInterlock() {
            return interlock;
        }

        public String getMessage() {
            return message;
        }
    }

    public static class Builder {

        private final Map<DeviceType, Map<CommandType, List<Interlock>>> rules = new EnumMap<>(DeviceType.class);

        /**
         * Append an interlock for a (device type, command type) pair.
         *
         * @throws IllegalArgumentException if the device type does not support
         *                                  the command
         */
        public Builder rule(DeviceType deviceType, CommandType commandType, Interlock interlock) {
            Objects.requireNonNull(deviceType, "DeviceType must not be null");
            Objects.requireNonNull(commandType, "CommandType must not be null");
            Objects.requireNonNull(interlock, "Interlock must not be null");
            if (!commandType.isSupportedBy(deviceType)) {
                throw new IllegalArgumentException(
                        commandType.getCode() + " is not a command of " + deviceType.getCode());
            }
            rules.computeIfAbsent(deviceType, t -> new EnumMap<>(CommandType.class))
                    .computeIfAbsent(commandType, c -> new ArrayList<>())
                    .add(interlock);
            return this;
        }

        public InterlockTable build() {
            Map<DeviceType, Map<CommandType, List<Interlock>>> copy = new EnumMap<>(DeviceType.class);
            rules.forEach((deviceType, byCommand) -> {
                Map<CommandType, List<Interlock>> inner = new EnumMap<>(CommandType.class);
                byCommand.forEach((command, list) -> inner.put(command, List.copyOf(list)));
                copy.put(deviceType, inner);
            });
            return new InterlockTable(copy);
        }
    }
}
