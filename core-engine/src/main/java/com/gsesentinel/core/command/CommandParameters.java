package com.gsesentinel.core.command;

import com.gsesentinel.core.model.DeviceMode;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed parameters of a decoded command. Each command type decodes to exactly
 * one of the nested variants.
 *
 * @since 1.0.0
 */
public abstract class CommandParameters implements Serializable {

    private static final long serialVersionUID = 1L;

    private CommandParameters() {
    }

    /** Commands that take no parameters. */
    public static final class None extends CommandParameters {

        private static final long serialVersionUID = 1L;

        public static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public String toString() {
            return "{}";
        }
    }

    /** {@code set_mode}. */
    public static final class ModeChange extends CommandParameters {

        private static final long serialVersionUID = 1L;

        private final DeviceMode mode;

        public ModeChange(DeviceMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode must not be null");
        }

        public DeviceMode getMode() {
            return mode;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ModeChange that && mode == that.mode;
        }

        @Override
        public int hashCode() {
            return mode.hashCode();
        }

        @Override
        public String toString() {
            return "{mode=" + mode + '}';
        }
    }

    /** {@code open_valve}: target position in percent. */
    public static final class ValvePosition extends CommandParameters {

        private static final long serialVersionUID = 1L;

        private final double position;

        public ValvePosition(double position) {
            this.position = position;
        }

        public double getPosition() {
            return position;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ValvePosition that && Double.compare(position, that.position) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(position);
        }

        @Override
        public String toString() {
            return "{position=" + position + '}';
        }
    }

    /** {@code set_voltage}: output voltage setpoint in volts. */
    public static final class Voltage extends CommandParameters {

        private static final long serialVersionUID = 1L;

        private final double voltage;

        public Voltage(double voltage) {
            this.voltage = voltage;
        }

        public double getVoltage() {
            return voltage;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Voltage that && Double.compare(voltage, that.voltage) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(voltage);
        }

        @Override
        public String toString() {
            return "{voltage=" + voltage + '}';
        }
    }

    /** {@code set_current_limit}: output current limit in amperes. */
    public static final class CurrentLimit extends CommandParameters {

        private static final long serialVersionUID = 1L;

        private final double current;

        public CurrentLimit(double current) {
            this.current = current;
        }

        public double getCurrent() {
            return current;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof CurrentLimit that && Double.compare(current, that.current) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(current);
        }

        @Override
        public String toString() {
            return "{current=" + current + '}';
        }
    }
}
