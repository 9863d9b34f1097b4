package com.gsesentinel.core.catalog;

import com.gsesentinel.core.config.MonitorConfig;
import com.gsesentinel.core.config.ParameterOverride;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.ParameterDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ParameterCatalog} built from the per-device-type built-in catalog,
 * with bounds replaced where the configuration supplies overrides.
 *
 * @since 1.0.0
 */
public final class ConfiguredParameterCatalog implements ParameterCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(ConfiguredParameterCatalog.class);

    private final Map<DeviceType, Map<String, ParameterDefinition>> definitions;

    private ConfiguredParameterCatalog(Map<DeviceType, Map<String, ParameterDefinition>> definitions) {
        this.definitions = definitions;
    }

    /**
     * @return catalog holding only the built-in definitions
     */
    public static ConfiguredParameterCatalog builtIn() {
        return from(new MonitorConfig());
    }

    /**
     * Build a catalog from the built-in definitions plus the overrides in
     * {@code config}. The configuration is expected to be validated.
     *
     * @param config monitor configuration; must not be {@code null}
     * @return new catalog
     */
    public static ConfiguredParameterCatalog from(MonitorConfig config) {
        Objects.requireNonNull(config, "MonitorConfig must not be null");

        Map<DeviceType, Map<String, ParameterDefinition>> byType = new EnumMap<>(DeviceType.class);
        for (DeviceType type : DeviceType.values()) {
            Map<String, ParameterDefinition> byName = new LinkedHashMap<>();
            for (ParameterDefinition p : type.parameters()) {
                byName.put(p.getName(), p);
            }
            byType.put(type, byName);
        }

        for (ParameterOverride override : config.getParameters()) {
            DeviceType type = DeviceType.fromCode(override.getDeviceType());
            ParameterDefinition base = byType.get(type).get(override.getName());
            if (base == null) {
                throw new IllegalArgumentException("Parameter '" + override.getName()
                        + "' is not defined for " + type.getCode());
            }
            ParameterDefinition replaced = base.withBounds(
                    override.getMin() != null ? override.getMin() : base.getMinimum(),
                    override.getMax() != null ? override.getMax() : base.getMaximum(),
                    override.getNominal() != null ? override.getNominal() : base.getNominal());
            byType.get(type).put(replaced.getName(), replaced);
            LOG.info("Parameter bounds overridden: {}/{} -> [{}, {}]",
                    type.getCode(), replaced.getName(), replaced.getMinimum(), replaced.getMaximum());
        }

        byType.replaceAll((type, byName) -> Collections.unmodifiableMap(byName));
        return new ConfiguredParameterCatalog(Collections.unmodifiableMap(byType));
    }

    @Override
    public Optional<ParameterDefinition> find(DeviceType deviceType, String parameter) {
        Objects.requireNonNull(deviceType, "DeviceType must not be null");
        if (parameter == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions.get(deviceType).get(parameter));
    }
}
