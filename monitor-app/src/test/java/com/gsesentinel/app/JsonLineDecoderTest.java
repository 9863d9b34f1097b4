package com.gsesentinel.app;

import com.gsesentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonLineDecoder}.
 */
class JsonLineDecoderTest {

    private final JsonLineDecoder decoder = new JsonLineDecoder("console");

    @Test
    @DisplayName("Should decode a telemetry line with a reported status")
    void shouldDecodeTelemetry() {
        ReplayMessage message = decode("{\"device_id\":\"GPU-001\",\"parameter\":\"voltage\","
                + "\"timestamp\":\"2024-03-01T12:00:00Z\",\"value\":28.1,\"status\":\"warning\"}");

        assertThat(message.getKind()).isEqualTo(ReplayMessage.Kind.TELEMETRY);
        assertThat(message.getTelemetry().getDeviceId()).isEqualTo("GPU-001");
        assertThat(message.getTelemetry().getValue()).isEqualTo(28.1);
        assertThat(message.getTelemetry().getReportedStatus()).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("Should decode a command and fill in the default issuer")
    void shouldDecodeCommandWithDefaultIssuer() {
        ReplayMessage message = decode("{\"type\":\"command\",\"device_id\":\"CRYO-001\","
                + "\"command_type\":\"open_valve\",\"parameters\":{\"position\":50}}");

        assertThat(message.getKind()).isEqualTo(ReplayMessage.Kind.COMMAND);
        assertThat(message.getCommand().getCommandType()).isEqualTo("open_valve");
        assertThat(message.getCommand().getParameters()).containsEntry("position", 50);
        assertThat(message.getCommand().getIssuedBy()).isEqualTo("console");
    }

    @Test
    @DisplayName("Should keep an explicit issuer")
    void shouldKeepExplicitIssuer() {
        ReplayMessage message = decode("{\"device_id\":\"GPU-001\",\"command_type\":\"disable_output\","
                + "\"issued_by\":\"alice\"}");

        assertThat(message.getCommand().getIssuedBy()).isEqualTo("alice");
    }

    @Test
    @DisplayName("Should decode execution results and acknowledgments")
    void shouldDecodeResultAndAck() {
        ReplayMessage result = decode("{\"type\":\"command_result\",\"command_id\":7,\"success\":false,"
                + "\"detail\":\"valve stuck\"}");
        assertThat(result.getKind()).isEqualTo(ReplayMessage.Kind.EXECUTION_RESULT);
        assertThat(result.getTargetId()).isEqualTo(7L);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDetail()).isEqualTo("valve stuck");

        ReplayMessage ack = decode("{\"type\":\"ACKNOWLEDGE\",\"alarm_id\":3}");
        assertThat(ack.getKind()).isEqualTo(ReplayMessage.Kind.ACKNOWLEDGE);
        assertThat(ack.getTargetId()).isEqualTo(3L);
        assertThat(ack.getOperator()).isEqualTo("console");
    }

    @Test
    @DisplayName("Should skip blank, comment and malformed lines")
    void shouldSkipUnusableLines() {
        assertThat(decoder.decode("")).isEmpty();
        assertThat(decoder.decode("   ")).isEmpty();
        assertThat(decoder.decode("# replay of pad 39A")).isEmpty();
        assertThat(decoder.decode("{not json")).isEmpty();
        assertThat(decoder.decode("[1, 2, 3]")).isEmpty();
        assertThat(decoder.decode("{\"type\":\"teleport\"}")).isEmpty();
        assertThat(decoder.decode("{\"type\":\"acknowledge\",\"alarm_id\":\"abc\"}")).isEmpty();
        assertThat(decoder.decode("{\"device_id\":\"GPU-001\",\"parameter\":\"voltage\","
                + "\"timestamp\":\"2024-03-01T12:00:00Z\",\"value\":28.1,\"status\":\"on fire\"}")).isEmpty();
    }

    @Test
    @DisplayName("Should ignore unknown properties")
    void shouldIgnoreUnknownProperties() {
        ReplayMessage message = decode("{\"device_id\":\"GPU-001\",\"parameter\":\"current\","
                + "\"timestamp\":\"2024-03-01T12:00:00Z\",\"value\":12.0,\"station\":\"pad-2\"}");

        assertThat(message.getTelemetry().getParameter()).isEqualTo("current");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private ReplayMessage decode(String line) {
        Optional<ReplayMessage> message = decoder.decode(line);
        assertThat(message).isPresent();
        return message.get();
    }
}
