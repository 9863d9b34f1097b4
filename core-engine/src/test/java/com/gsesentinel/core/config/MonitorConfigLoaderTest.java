package com.gsesentinel.core.config;

import com.gsesentinel.core.model.DeviceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorConfigLoader}.
 */
class MonitorConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        MonitorConfig config = MonitorConfigLoader.fromClasspath("test-monitor.yml");

        assertThat(config.getWindowSize()).isEqualTo(50);
        assertThat(config.getMinSamples()).isEqualTo(10);
        assertThat(config.getSigmaThreshold()).isEqualTo(2.5);
        assertThat(config.getClearHysteresis()).isEqualTo(3);
        assertThat(config.getFaultRangeFraction()).isEqualTo(0.10);
        assertThat(config.getDevices()).extracting(DeviceConfig::getId)
                .containsExactly("GPU-001", "GPU-002", "CRYO-001");
        assertThat(config.getDevices().get(1).deviceType()).isEqualTo(DeviceType.GROUND_POWER_UNIT);
        assertThat(config.getParameters()).hasSize(1);
        assertThat(config.getParameters().get(0).getMax()).isEqualTo(30.0);
    }

    @Test
    @DisplayName("Should ship a default configuration registering GPU-001 and CRYO-001")
    void shouldLoadDefaultResource() {
        MonitorConfig config = MonitorConfigLoader.fromClasspath(MonitorConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getWindowSize()).isEqualTo(100);
        assertThat(config.getMinSamples()).isEqualTo(30);
        assertThat(config.getClearHysteresis()).isEqualTo(5);
        assertThat(config.getDevices()).extracting(DeviceConfig::deviceType)
                .containsExactly(DeviceType.GROUND_POWER_UNIT, DeviceType.CRYOGENIC_LINE);
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldCollectAllValidationErrors() {
        assertThatThrownBy(() -> MonitorConfigLoader.fromClasspath("invalid-monitor.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'windowSize' must be >= 2")
                .hasMessageContaining("'minSamples' (40) must not exceed 'windowSize' (1)")
                .hasMessageContaining("'sigmaThreshold' must be > 0")
                .hasMessageContaining("'clearHysteresis' must be >= 2")
                .hasMessageContaining("Duplicate device id: 'GPU-001'")
                .hasMessageContaining("Unknown device type")
                .hasMessageContaining("is not a parameter of cryogenic_line");
    }

    @Test
    @DisplayName("Should wrap malformed YAML in IllegalStateException")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> MonitorConfigLoader.fromClasspath("malformed-monitor.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed monitor configuration");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> MonitorConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load configuration from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("site.yml");
        Files.writeString(file, String.join("\n",
                "clearHysteresis: 7",
                "devices:",
                "  - id: CRYO-009",
                "    type: cryogenic_line",
                ""));

        MonitorConfig config = MonitorConfigLoader.fromFile(file.toString());

        assertThat(config.getClearHysteresis()).isEqualTo(7);
        assertThat(config.getDevices()).extracting(DeviceConfig::getId).containsExactly("CRYO-009");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        MonitorConfig config = MonitorConfigLoader.fromFile(file.toString());

        assertThat(config.getWindowSize()).isEqualTo(100);
        assertThat(config.getDevices()).isEmpty();
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> MonitorConfigLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }
}
