package com.gsesentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable reference data for one telemetry parameter of a device type:
 * engineering unit, legal range and nominal value.
 *
 * @since 1.0.0
 */
public final class ParameterDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String unit;
    private final double minimum;
    private final double maximum;
    private final double nominal;

    /**
     * @param name    parameter name; must not be {@code null} or blank
     * @param unit    engineering unit; may be {@code null}
     * @param minimum lower bound (inclusive)
     * @param maximum upper bound (inclusive); must be greater than
     *                {@code minimum}
     * @param nominal nominal operating value
     * @throws IllegalArgumentException if the name is blank or the range is
     *                                  empty
     */
    public ParameterDefinition(String name, String unit, double minimum, double maximum, double nominal) {
        Objects.requireNonNull(name, "Parameter name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        if (!(maximum > minimum)) {
            throw new IllegalArgumentException(
                    "Parameter '" + name + "' requires maximum > minimum, got [" + minimum + ", " + maximum + "]");
        }
        this.name = name;
        this.unit = unit;
        this.minimum = minimum;
        this.maximum = maximum;
        this.nominal = nominal;
    }

    /**
     * Return a copy with different bounds, keeping the name and unit.
     *
     * @param minimum new lower bound
     * @param maximum new upper bound
     * @param nominal new nominal value
     * @return new definition
     */
    public ParameterDefinition withBounds(double minimum, double maximum, double nominal) {
        return new ParameterDefinition(name, unit, minimum, maximum, nominal);
    }

    public String getName() {
        return name;
    }

    public String getUnit() {
        return unit;
    }

    public double getMinimum() {
        return minimum;
    }

    public double getMaximum() {
        return maximum;
    }

    public double getNominal() {
        return nominal;
    }

    /**
     * @return width of the legal range, {@code maximum - minimum}
     */
    public double range() {
        return maximum - minimum;
    }

    /**
     * @param value value to test
     * @return {@code true} if {@code minimum <= value <= maximum}
     */
    public boolean contains(double value) {
        return value >= minimum && value <= maximum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ParameterDefinition that))
            return false;
        return Double.compare(minimum, that.minimum) == 0
                && Double.compare(maximum, that.maximum) == 0
                && Double.compare(nominal, that.nominal) == 0
                && name.equals(that.name)
                && Objects.equals(unit, that.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, unit, minimum, maximum, nominal);
    }

    @Override
    public String toString() {
        return "ParameterDefinition{" +
                "name='" + name + '\'' +
                ", unit='" + unit + '\'' +
                ", minimum=" + minimum +
                ", maximum=" + maximum +
                ", nominal=" + nominal +
                '}';
    }
}
