package com.gsesentinel.core.command;

import com.gsesentinel.core.model.Alarm;
import com.gsesentinel.core.model.DeviceState;
import com.gsesentinel.core.model.Severity;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything an interlock predicate may look at: the device's state, its
 * latest telemetry, its active alarms and the decoded command parameters.
 *
 * @since 1.0.0
 */
public final class InterlockContext {

    private final DeviceState state;
    private final Map<String, Double> latestTelemetry;
    private final List<Alarm> activeAlarms;
    private final CommandParameters parameters;

    public InterlockContext(DeviceState state, Map<String, Double> latestTelemetry,
            List<Alarm> activeAlarms, CommandParameters parameters) {
        this.state = Objects.requireNonNull(state, "DeviceState must not be null");
        this.latestTelemetry = latestTelemetry == null ? Map.of() : Map.copyOf(latestTelemetry);
        this.activeAlarms = activeAlarms == null ? List.of() : List.copyOf(activeAlarms);
        this.parameters = parameters == null ? CommandParameters.None.INSTANCE : parameters;
    }

    public DeviceState getState() {
        return state;
    }

    /**
     * @param parameter parameter name
     * @return the last value received for the parameter, or empty if none
     */
    public Optional<Double> latest(String parameter) {
        return Optional.ofNullable(latestTelemetry.get(parameter));
    }

    public List<Alarm> getActiveAlarms() {
        return activeAlarms;
    }

    /**
     * @param severity minimum severity
     * @return {@code true} if any active alarm is at or above the severity
     */
    public boolean hasActiveAlarmAtLeast(Severity severity) {
        return activeAlarms.stream().anyMatch(a -> a.getSeverity().isAtLeast(severity));
    }

    public CommandParameters getParameters() {
        return parameters;
    }
}
