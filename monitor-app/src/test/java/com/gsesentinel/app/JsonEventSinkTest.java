package com.gsesentinel.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsesentinel.core.command.CommandParameters;
import com.gsesentinel.core.command.CommandRecord;
import com.gsesentinel.core.command.CommandStatus;
import com.gsesentinel.core.command.RejectionReason;
import com.gsesentinel.core.event.MonitorEvent;
import com.gsesentinel.core.event.MonitorEventType;
import com.gsesentinel.core.model.Alarm;
import com.gsesentinel.core.model.AlarmState;
import com.gsesentinel.core.model.AlarmType;
import com.gsesentinel.core.model.DeviceMode;
import com.gsesentinel.core.model.DeviceState;
import com.gsesentinel.core.model.DeviceType;
import com.gsesentinel.core.model.OperationalStatus;
import com.gsesentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonEventSink}.
 */
class JsonEventSinkTest {

    private static final Instant AT = Instant.parse("2024-03-01T12:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should write a cleared alarm event as one JSON line with ISO timestamps")
    void shouldWriteAlarmEvent() throws IOException {
        StringWriter out = new StringWriter();
        Alarm alarm = Alarm.builder()
                .id(4)
                .deviceId("GPU-001")
                .parameter("voltage")
                .severity(Severity.FAULT)
                .type(AlarmType.THRESHOLD_HIGH)
                .state(AlarmState.CLEARED)
                .thresholdValue(32.0)
                .actualValue(40.0)
                .triggeredAt(AT)
                .clearedAt(AT.plusSeconds(90))
                .build();

        new JsonEventSink(out).publish(MonitorEvent.ofAlarm(MonitorEventType.ALARM_CLEARED, AT.plusSeconds(90), alarm));

        String[] lines = out.toString().split("\\R");
        assertThat(lines).hasSize(1);
        JsonNode json = mapper.readTree(lines[0]);
        assertThat(json.get("event").asText()).isEqualTo("ALARM_CLEARED");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-01T12:01:30Z");
        assertThat(json.get("device_id").asText()).isEqualTo("GPU-001");
        assertThat(json.at("/alarm/id").asLong()).isEqualTo(4L);
        assertThat(json.at("/alarm/type").asText()).isEqualTo("THRESHOLD_HIGH");
        assertThat(json.at("/alarm/threshold_value").asDouble()).isEqualTo(32.0);
        assertThat(json.at("/alarm/acknowledged").asBoolean()).isFalse();
        assertThat(json.at("/alarm/duration_seconds").asDouble()).isEqualTo(90.0);
        assertThat(json.has("command")).isFalse();
    }

    @Test
    @DisplayName("Should render both states of a device state change")
    void shouldWriteStateChange() throws IOException {
        DeviceState before = new DeviceState("CRYO-001", DeviceType.CRYOGENIC_LINE, DeviceMode.ACTIVE,
                OperationalStatus.NOMINAL, null, null);
        DeviceState after = new DeviceState("CRYO-001", DeviceType.CRYOGENIC_LINE, DeviceMode.EMERGENCY_SHUTDOWN,
                OperationalStatus.SHUTDOWN, "emergency_shutdown", AT);
        JsonEventSink sink = new JsonEventSink(new StringWriter());

        JsonNode json = mapper.readTree(sink.toJson(MonitorEvent.ofStateChange(AT, before, after,
                "emergency_shutdown")));

        assertThat(json.at("/previous_state/mode").asText()).isEqualTo("ACTIVE");
        assertThat(json.at("/device_state/mode").asText()).isEqualTo("EMERGENCY_SHUTDOWN");
        assertThat(json.at("/device_state/status").asText()).isEqualTo("SHUTDOWN");
        assertThat(json.at("/device_state/device_type").asText()).isEqualTo("cryogenic_line");
        assertThat(json.at("/device_state/last_command_at").asText()).isEqualTo("2024-03-01T12:00:00Z");
    }

    @Test
    @DisplayName("Should render a rejected command without an id")
    void shouldWriteRejectedCommand() throws IOException {
        CommandRecord rejected = CommandRecord.builder()
                .deviceId("CRYO-001")
                .commandType("open_valve")
                .parameters(CommandParameters.None.INSTANCE)
                .issuedBy("alice")
                .submittedAt(AT)
                .status(CommandStatus.REJECTED)
                .rejectionReason(RejectionReason.INTERLOCK_VIOLATION)
                .detail("Temperature too high for valve operation")
                .completedAt(AT)
                .build();
        JsonEventSink sink = new JsonEventSink(new StringWriter());

        JsonNode json = mapper.readTree(sink.toJson(MonitorEvent.ofCommand(MonitorEventType.COMMAND_REJECTED, AT,
                rejected)));

        assertThat(json.at("/command/id").isNull()).isTrue();
        assertThat(json.at("/command/status").asText()).isEqualTo("REJECTED");
        assertThat(json.at("/command/rejection_reason").asText()).isEqualTo("INTERLOCK_VIOLATION");
        assertThat(json.get("description").asText()).contains("Temperature too high");
    }

    @Test
    @DisplayName("Should rethrow write failures")
    void shouldRethrowWriteFailures() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        CommandRecord admitted = CommandRecord.builder()
                .id(1)
                .deviceId("GPU-001")
                .commandType("disable_output")
                .parameters(CommandParameters.None.INSTANCE)
                .issuedBy("alice")
                .submittedAt(AT)
                .status(CommandStatus.ADMITTED)
                .build();

        assertThatThrownBy(() -> new JsonEventSink(broken)
                .publish(MonitorEvent.ofCommand(MonitorEventType.COMMAND_ADMITTED, AT, admitted)))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("COMMAND_ADMITTED");
    }
}
