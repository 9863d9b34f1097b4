package com.gsesentinel.core.command;

import com.gsesentinel.core.model.DeviceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CommandType}.
 */
class CommandTypeTest {

    @Test
    @DisplayName("Should expose the ground power unit command set")
    void shouldListGroundPowerUnitCommands() {
        assertThat(Arrays.stream(CommandType.values())
                .filter(t -> t.isSupportedBy(DeviceType.GROUND_POWER_UNIT))
                .map(CommandType::getCode))
                .containsExactlyInAnyOrder("set_mode", "enable_output", "disable_output", "set_voltage",
                        "set_current_limit", "inject_fault", "clear_fault", "emergency_shutdown");
    }

    @Test
    @DisplayName("Should expose the cryogenic line command set")
    void shouldListCryogenicLineCommands() {
        assertThat(Arrays.stream(CommandType.values())
                .filter(t -> t.isSupportedBy(DeviceType.CRYOGENIC_LINE))
                .map(CommandType::getCode))
                .containsExactlyInAnyOrder("set_mode", "open_valve", "close_valve", "inject_leak",
                        "inject_valve_stuck", "clear_fault", "emergency_shutdown");
    }

    @Test
    @DisplayName("Should resolve wire codes case-insensitively")
    void shouldResolveCodes() {
        assertThat(CommandType.fromCode("OPEN_VALVE")).contains(CommandType.OPEN_VALVE);
        assertThat(CommandType.fromCode("warp")).isEmpty();
        assertThat(CommandType.fromCode(null)).isEmpty();
        assertThat(CommandType.EMERGENCY_SHUTDOWN.isPriority()).isTrue();
    }
}
