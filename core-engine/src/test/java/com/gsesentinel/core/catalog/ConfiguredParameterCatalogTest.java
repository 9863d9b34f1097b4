package com.gsesentinel.core.catalog;

import com.gsesentinel.core.config.MonitorConfig;
import com.gsesentinel.core.config.MonitorConfigLoader;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.ParameterDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConfiguredParameterCatalog}.
 */
class ConfiguredParameterCatalogTest {

    @Test
    @DisplayName("Should expose the built-in ground power unit and cryogenic line parameters")
    void shouldExposeBuiltInCatalog() {
        ConfiguredParameterCatalog catalog = ConfiguredParameterCatalog.builtIn();

        ParameterDefinition voltage = catalog.find(DeviceType.GROUND_POWER_UNIT, "voltage").orElseThrow();
        assertThat(voltage.getUnit()).isEqualTo("V");
        assertThat(voltage.getMinimum()).isEqualTo(20.0);
        assertThat(voltage.getMaximum()).isEqualTo(32.0);
        assertThat(voltage.getNominal()).isEqualTo(28.0);

        ParameterDefinition level = catalog.find(DeviceType.CRYOGENIC_LINE, "liquid_level").orElseThrow();
        assertThat(level.getNominal()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("Should not find parameters of another device type")
    void shouldScopeParametersByDeviceType() {
        ConfiguredParameterCatalog catalog = ConfiguredParameterCatalog.builtIn();

        assertThat(catalog.find(DeviceType.GROUND_POWER_UNIT, "valve_position")).isEmpty();
        assertThat(catalog.find(DeviceType.CRYOGENIC_LINE, "voltage")).isEmpty();
        assertThat(catalog.find(DeviceType.CRYOGENIC_LINE, null)).isEmpty();
    }

    @Test
    @DisplayName("Should apply configured bound overrides")
    void shouldApplyOverrides() {
        MonitorConfig config = MonitorConfigLoader.fromClasspath("test-monitor.yml");

        ConfiguredParameterCatalog catalog = ConfiguredParameterCatalog.from(config);

        ParameterDefinition voltage = catalog.find(DeviceType.GROUND_POWER_UNIT, "voltage").orElseThrow();
        assertThat(voltage.getMinimum()).isEqualTo(22.0);
        assertThat(voltage.getMaximum()).isEqualTo(30.0);
        assertThat(voltage.getNominal()).isEqualTo(28.0);
        assertThat(catalog.find(DeviceType.CRYOGENIC_LINE, "temperature").orElseThrow().getMinimum())
                .isEqualTo(-273.0);
    }
}
