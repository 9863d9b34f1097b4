package com.gsesentinel.core.catalog;

import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.ParameterDefinition;

import java.util.Optional;

/**
 * Source of validated parameter definitions, keyed by
 * (device type, parameter name).
 *
 * @since 1.0.0
 */
public interface ParameterCatalog {

    /**
     * @param deviceType device type; must not be {@code null}
     * @param parameter  parameter name
     * @return the definition, or empty if the type has no such parameter
     */
    Optional<ParameterDefinition> find(DeviceType deviceType, String parameter);
}
