package com.gsesentinel.core.command;

import com.gsesentinel.core.model.Alarm;
import com.gsesentinel.core.model.AlarmType;
import com.gsesentinel.core.model.CommandRequest;
import com.gsesentinel.core.model.DeviceMode;
import com.gsesentinel.core.model.DeviceState;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.OperationalStatus;
import com.gsesentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CommandValidator}.
 */
class CommandValidatorTest {

    private final CommandValidator validator = new CommandValidator(InterlockTable.standard());

    @Test
    @DisplayName("Should admit emergency_shutdown regardless of state and alarms")
    void shouldAlwaysAdmitEmergencyShutdown() {
        DeviceState state = gpu(DeviceMode.EMERGENCY_SHUTDOWN, OperationalStatus.SHUTDOWN);

        Admission admission = validator.validate(request("GPU-001", "emergency_shutdown", Map.of()), state,
                Map.of(), List.of(alarm(Severity.CRITICAL)));

        assertThat(admission.isAdmitted()).isTrue();
        assertThat(admission.getCommandType()).isEqualTo(CommandType.EMERGENCY_SHUTDOWN);
    }

    @Test
    @DisplayName("Should reject commands of another device type and unknown commands")
    void shouldRejectUnsupported() {
        DeviceState state = gpu(DeviceMode.ACTIVE, OperationalStatus.NOMINAL);

        Admission foreign = validator.validate(request("GPU-001", "open_valve", Map.of("position", 50)), state,
                Map.of(), List.of());
        Admission unknown = validator.validate(request("GPU-001", "self_destruct", Map.of()), state,
                Map.of(), List.of());

        assertThat(foreign.getReason()).isEqualTo(RejectionReason.UNSUPPORTED_COMMAND);
        assertThat(foreign.getDetail()).contains("ground_power_unit");
        assertThat(unknown.getReason()).isEqualTo(RejectionReason.UNSUPPORTED_COMMAND);
    }

    @Test
    @DisplayName("Should reject invalid parameters before checking emergency shutdown")
    void shouldRejectInvalidParameters() {
        DeviceState state = gpu(DeviceMode.EMERGENCY_SHUTDOWN, OperationalStatus.SHUTDOWN);

        Admission admission = validator.validate(request("GPU-001", "set_voltage", Map.of("voltage", 50)), state,
                Map.of(), List.of());

        assertThat(admission.getReason()).isEqualTo(RejectionReason.INVALID_PARAMETER);
        assertThat(admission.getDetail()).contains("voltage");
    }

    @Test
    @DisplayName("Should only accept recovery set_mode while in emergency shutdown")
    void shouldGateEmergencyShutdown() {
        DeviceState state = gpu(DeviceMode.EMERGENCY_SHUTDOWN, OperationalStatus.SHUTDOWN);

        assertThat(validator.validate(request("GPU-001", "disable_output", Map.of()), state, Map.of(), List.of())
                .getReason()).isEqualTo(RejectionReason.EMERGENCY_SHUTDOWN_ACTIVE);
        assertThat(validator.validate(request("GPU-001", "set_mode", Map.of("mode", "EMERGENCY_SHUTDOWN")), state,
                Map.of(), List.of()).getReason()).isEqualTo(RejectionReason.EMERGENCY_SHUTDOWN_ACTIVE);

        Admission recovery = validator.validate(request("GPU-001", "set_mode", Map.of("mode", "STANDBY")), state,
                Map.of(), List.of());
        assertThat(recovery.isAdmitted()).isTrue();
        assertThat(recovery.getParameters()).isEqualTo(new CommandParameters.ModeChange(DeviceMode.STANDBY));
    }

    @Test
    @DisplayName("Should reject enable_output outside ACTIVE mode with the interlock message")
    void shouldApplyInterlocks() {
        Admission admission = validator.validate(request("GPU-001", "enable_output", Map.of()),
                gpu(DeviceMode.STANDBY, OperationalStatus.NOMINAL), Map.of(), List.of());

        assertThat(admission.getReason()).isEqualTo(RejectionReason.INTERLOCK_VIOLATION);
        assertThat(admission.getDetail()).contains("ACTIVE");
    }

    @Test
    @DisplayName("Should never gate disable_output or close_valve behind interlocks")
    void shouldNotGateSafingCommands() {
        List<Alarm> critical = List.of(alarm(Severity.CRITICAL));

        assertThat(validator.validate(request("GPU-001", "disable_output", Map.of()),
                gpu(DeviceMode.STANDBY, OperationalStatus.FAULT), Map.of(), critical).isAdmitted()).isTrue();
        assertThat(validator.validate(request("CRYO-001", "close_valve", Map.of()),
                cryo(DeviceMode.MAINTENANCE, OperationalStatus.FAULT), Map.of("temperature", 25.0), critical)
                .isAdmitted()).isTrue();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static CommandRequest request(String deviceId, String command, Map<String, Object> params) {
        return new CommandRequest(deviceId, command, params, "test-operator");
    }

    private static DeviceState gpu(DeviceMode mode, OperationalStatus status) {
        return new DeviceState("GPU-001", DeviceType.GROUND_POWER_UNIT, mode, status, null, null);
    }

    private static DeviceState cryo(DeviceMode mode, OperationalStatus status) {
        return new DeviceState("CRYO-001", DeviceType.CRYOGENIC_LINE, mode, status, null, null);
    }

    private static Alarm alarm(Severity severity) {
        return Alarm.builder()
                .id(1L)
                .deviceId("GPU-001")
                .parameter("temperature")
                .type(AlarmType.DEVICE_FAULT)
                .severity(severity)
                .actualValue(140.0)
                .triggeredAt(Instant.parse("2024-03-01T12:00:00Z"))
                .build();
    }
}
