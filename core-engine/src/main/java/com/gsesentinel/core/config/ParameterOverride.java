package com.gsesentinel.core.config;

import com.gsesentinel.core.model.DeviceType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Site-specific bounds for one parameter of a device type, replacing the
 * built-in catalog values.
 *
 * <pre>
 * parameters:
 *   - deviceType: cryogenic_line
 *     name: pressure
 *     min: 0
 *     max: 90
 * </pre>
 *
 * <p>
 * Any of {@code min}, {@code max} and {@code nominal} may be omitted; omitted
 * values keep the built-in definition.
 * </p>
 *
 * @since 1.0.0
 */
public class ParameterOverride implements Serializable {

    private static final long serialVersionUID = 1L;

    private String deviceType;
    private String name;
    private Double min;
    private Double max;
    private Double nominal;

    List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Parameter override 'name' is required");
            return errors;
        }
        DeviceType type;
        try {
            type = DeviceType.fromCode(deviceType);
        } catch (IllegalArgumentException e) {
            errors.add("Parameter override '" + name + "': " + e.getMessage());
            return errors;
        }
        var builtIn = type.parameter(name);
        if (builtIn.isEmpty()) {
            errors.add("Parameter override '" + name + "' is not a parameter of " + type.getCode());
            return errors;
        }
        double lo = min != null ? min : builtIn.get().getMinimum();
        double hi = max != null ? max : builtIn.get().getMaximum();
        if (!(hi > lo)) {
            errors.add("Parameter override '" + type.getCode() + "/" + name
                    + "' requires max > min, got [" + lo + ", " + hi + "]");
        }
        return errors;
    }

    public String getDeviceType() {
        return deviceType;
    }

    public void setDeviceType(String deviceType) {
        this.deviceType = deviceType != null ? deviceType.toLowerCase(Locale.ROOT) : null;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Double getMin() {
        return min;
    }

    public void setMin(Double min) {
        this.min = min;
    }

    public Double getMax() {
        return max;
    }

    public void setMax(Double max) {
        this.max = max;
    }

    public Double getNominal() {
        return nominal;
    }

    public void setNominal(Double nominal) {
        this.nominal = nominal;
    }

    @Override
    public String toString() {
        return "ParameterOverride{" +
                "deviceType='" + deviceType + '\'' +
                ", name='" + name + '\'' +
                ", min=" + min +
                ", max=" + max +
                ", nominal=" + nominal +
                '}';
    }
}
