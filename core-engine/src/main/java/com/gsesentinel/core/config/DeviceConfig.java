package com.gsesentinel.core.config;

import com.gsesentinel.core.model.DeviceType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Registration of one monitored device, loaded from configuration.
 *
 * <pre>
 * devices:
 *   - id: GPU-001
 *     type: ground_power_unit
 * </pre>
 *
 * @since 1.0.0
 */
public class DeviceConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Unique device identifier, e.g. {@code CRYO-001}. */
    private String id;

    /** Device type code, e.g. {@code cryogenic_line}. */
    private String type;

    public DeviceConfig() {
    }

    public DeviceConfig(String id, String type) {
        this.id = id;
        setType(type);
    }

    /**
     * Collect validation errors for this entry.
     *
     * @return list of error messages, empty if valid
     */
    List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (id == null || id.isBlank()) {
            errors.add("Device 'id' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Device '" + id + "' requires 'type'");
        } else {
            try {
                DeviceType.fromCode(type);
            } catch (IllegalArgumentException e) {
                errors.add("Device '" + id + "': " + e.getMessage());
            }
        }
        return errors;
    }

    /**
     * @return the resolved device type
     * @throws IllegalArgumentException if the type code is unknown
     */
    public DeviceType deviceType() {
        return DeviceType.fromCode(type);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the device type code, normalised to lowercase.
     *
     * @param type device type code
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeviceConfig that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return "DeviceConfig{id='" + id + "', type='" + type + "'}";
    }
}
