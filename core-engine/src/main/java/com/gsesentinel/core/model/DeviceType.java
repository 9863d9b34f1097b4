package com.gsesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of ground support equipment types.
 *
 * <p>
 * Each type carries its built-in parameter catalog. The command set and the
 * interlock rules for each type live in
 * {@link com.gsesentinel.core.command.CommandType} and
 * {@link com.gsesentinel.core.command.InterlockTable}.
 * </p>
 *
 * @since 1.0.0
 */
public enum DeviceType {

    GROUND_POWER_UNIT("ground_power_unit",
            new ParameterDefinition("voltage", "V", 20.0, 32.0, 28.0),
            new ParameterDefinition("current", "A", 0.0, 150.0, 50.0),
            new ParameterDefinition("power", "W", 0.0, 5000.0, 1400.0),
            new ParameterDefinition("temperature", "°C", -273.0, 150.0, 25.0)),

    CRYOGENIC_LINE("cryogenic_line",
            new ParameterDefinition("valve_position", "%", 0.0, 100.0, 0.0),
            new ParameterDefinition("pressure", "psi", 0.0, 100.0, 14.7),
            new ParameterDefinition("flow_rate", "L/min", 0.0, 600.0, 0.0),
            new ParameterDefinition("temperature", "°C", -273.0, 150.0, 25.0),
            new ParameterDefinition("liquid_level", "%", 0.0, 100.0, 75.0));

    private final String code;
    private final Map<String, ParameterDefinition> parameters;

    DeviceType(String code, ParameterDefinition... parameters) {
        this.code = code;
        Map<String, ParameterDefinition> byName = new LinkedHashMap<>();
        for (ParameterDefinition p : parameters) {
            byName.put(p.getName(), p);
        }
        this.parameters = Collections.unmodifiableMap(byName);
    }

    /**
     * @return wire code, e.g. {@code ground_power_unit}
     */
    public String getCode() {
        return code;
    }

    /**
     * @return built-in parameter definitions, in declaration order
     */
    public List<ParameterDefinition> parameters() {
        return List.copyOf(parameters.values());
    }

    /**
     * @param name parameter name
     * @return the built-in definition, or empty if this type has no such
     *         parameter
     */
    public Optional<ParameterDefinition> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    /**
     * Resolve a device type from its wire code or enum name.
     *
     * @param value code such as {@code cryogenic_line} or {@code CRYOGENIC_LINE}
     * @return the device type
     * @throws IllegalArgumentException if the value matches no device type
     */
    public static DeviceType fromCode(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DeviceType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown device type: '" + value
                + "'. Supported: ground_power_unit, cryogenic_line");
    }
}
