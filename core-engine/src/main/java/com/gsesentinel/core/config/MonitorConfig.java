package com.gsesentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the monitor YAML configuration.
 *
 * <p>
 * Expected YAML structure (every tuning value is optional and shown with its
 * default):
 * </p>
 *
 * <pre>
 * windowSize: 100
 * minSamples: 30
 * sigmaThreshold: 3.0
 * faultRangeFraction: 0.10
 * clearHysteresis: 5
 * alarmHistoryLimit: 1000
 * commandHistoryLimit: 1000
 * pendingCommandLimit: 1000
 * devices:
 *   - id: GPU-001
 *     type: ground_power_unit
 * parameters:
 *   - deviceType: ground_power_unit
 *     name: voltage
 *     max: 30
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every value.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Capacity of each rolling window. */
    private int windowSize = 100;

    /** Samples required before statistical detection engages. */
    private int minSamples = 30;

    /** Number of standard deviations that marks a statistical anomaly. */
    private double sigmaThreshold = 3.0;

    /** Fraction of the parameter range beyond a bound that escalates WARNING to FAULT. */
    private double faultRangeFraction = 0.10;

    /** Consecutive clean samples required before alarms on a series auto-clear. */
    private int clearHysteresis = 5;

    /** Number of cleared alarms retained for history queries. */
    private int alarmHistoryLimit = 1000;

    /** Number of closed commands and rejections retained by the ledger. */
    private int commandHistoryLimit = 1000;

    /** Number of admitted commands that may wait for an execution result. */
    private int pendingCommandLimit = 1000;

    private List<DeviceConfig> devices = new ArrayList<>();

    private List<ParameterOverride> parameters = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate tuning values, device registrations and parameter overrides.
     * Collects all errors and throws a single exception if any is invalid.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (windowSize < 2) {
            errors.add("'windowSize' must be >= 2, got: " + windowSize);
        }
        if (minSamples < 2) {
            errors.add("'minSamples' must be >= 2, got: " + minSamples);
        }
        if (minSamples > windowSize) {
            errors.add("'minSamples' (" + minSamples + ") must not exceed 'windowSize' (" + windowSize + ")");
        }
        if (sigmaThreshold <= 0) {
            errors.add("'sigmaThreshold' must be > 0, got: " + sigmaThreshold);
        }
        if (faultRangeFraction < 0) {
            errors.add("'faultRangeFraction' must be >= 0, got: " + faultRangeFraction);
        }
        if (clearHysteresis < 2) {
            errors.add("'clearHysteresis' must be >= 2, got: " + clearHysteresis);
        }
        if (alarmHistoryLimit < 0) {
            errors.add("'alarmHistoryLimit' must be >= 0, got: " + alarmHistoryLimit);
        }
        if (commandHistoryLimit < 0) {
            errors.add("'commandHistoryLimit' must be >= 0, got: " + commandHistoryLimit);
        }
        if (pendingCommandLimit < 1) {
            errors.add("'pendingCommandLimit' must be >= 1, got: " + pendingCommandLimit);
        }

        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < devices.size(); i++) {
            DeviceConfig device = Objects.requireNonNull(devices.get(i), "Device at index " + i + " is null");
            errors.addAll(device.validate());
            if (device.getId() != null && !seenIds.add(device.getId())) {
                errors.add("Duplicate device id: '" + device.getId() + "'");
            }
        }
        for (int i = 0; i < parameters.size(); i++) {
            ParameterOverride override = Objects.requireNonNull(parameters.get(i),
                    "Parameter override at index " + i + " is null");
            errors.addAll(override.validate());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitor configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getSigmaThreshold() {
        return sigmaThreshold;
    }

    public void setSigmaThreshold(double sigmaThreshold) {
        this.sigmaThreshold = sigmaThreshold;
    }

    public double getFaultRangeFraction() {
        return faultRangeFraction;
    }

    public void setFaultRangeFraction(double faultRangeFraction) {
        this.faultRangeFraction = faultRangeFraction;
    }

    public int getClearHysteresis() {
        return clearHysteresis;
    }

    public void setClearHysteresis(int clearHysteresis) {
        this.clearHysteresis = clearHysteresis;
    }

    public int getAlarmHistoryLimit() {
        return alarmHistoryLimit;
    }

    public void setAlarmHistoryLimit(int alarmHistoryLimit) {
        this.alarmHistoryLimit = alarmHistoryLimit;
    }

    public int getCommandHistoryLimit() {
        return commandHistoryLimit;
    }

    public void setCommandHistoryLimit(int commandHistoryLimit) {
        this.commandHistoryLimit = commandHistoryLimit;
    }

    public int getPendingCommandLimit() {
        return pendingCommandLimit;
    }

    public void setPendingCommandLimit(int pendingCommandLimit) {
        this.pendingCommandLimit = pendingCommandLimit;
    }

    /**
     * @return unmodifiable list of device registrations
     */
    public List<DeviceConfig> getDevices() {
        return Collections.unmodifiableList(devices);
    }

    public void setDevices(List<DeviceConfig> devices) {
        this.devices = devices != null ? new ArrayList<>(devices) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of parameter bound overrides
     */
    public List<ParameterOverride> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public void setParameters(List<ParameterOverride> parameters) {
        this.parameters = parameters != null ? new ArrayList<>(parameters) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "windowSize=" + windowSize +
                ", minSamples=" + minSamples +
                ", sigmaThreshold=" + sigmaThreshold +
                ", faultRangeFraction=" + faultRangeFraction +
                ", clearHysteresis=" + clearHysteresis +
                ", alarmHistoryLimit=" + alarmHistoryLimit +
                ", commandHistoryLimit=" + commandHistoryLimit +
                ", pendingCommandLimit=" + pendingCommandLimit +
                ", devices=" + devices +
                ", parameters=" + parameters +
                '}';
    }
}
