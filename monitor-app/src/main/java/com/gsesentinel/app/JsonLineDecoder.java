package com.gsesentinel.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gsesentinel.core.model.CommandRequest;
import com.gsesentinel.core.model.TelemetryPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Decodes JSON-lines replay input into {@link ReplayMessage}s.
 *
 * <p>
 * Each line is one JSON object. An explicit {@code "type"} field selects the
 * message kind ({@code telemetry}, {@code command}, {@code command_result},
 * {@code acknowledge}); without one, objects carrying {@code parameter} are
 * telemetry and objects carrying {@code command_type} are commands.
 * </p>
 * <p>
 * Malformed lines are logged and dropped (returns empty), so a single bad
 * record does not stop a replay.
 * </p>
 */
public class JsonLineDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLineDecoder.class);

    private final ObjectMapper mapper;
    private final String defaultIssuer;

    public JsonLineDecoder(String defaultIssuer) {
        this.defaultIssuer = defaultIssuer;
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param line one line of input
     * @return the decoded message, or empty for blank, comment or malformed
     *         lines
     */
    public Optional<ReplayMessage> decode(String line) {
        if (line == null || line.isBlank() || line.trim().startsWith("#")) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(line);
            if (node == null || !node.isObject()) {
                LOG.warn("Skipping replay line that is not a JSON object: {}", abbreviate(line));
                return Optional.empty();
            }
            return Optional.of(decodeObject(node));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warn("Failed to decode replay line, skipping: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private ReplayMessage decodeObject(JsonNode node) throws JsonProcessingException {
        String type = node.path("type").asText("").trim().toLowerCase(Locale.ROOT);
        if (type.isEmpty()) {
            type = node.has("command_type") ? "command" : node.has("parameter") ? "telemetry" : "";
        }
        switch (type) {
            case "telemetry":
                return ReplayMessage.telemetry(mapper.treeToValue(node, TelemetryPoint.class));
            case "command": {
                CommandRequest request = mapper.treeToValue(node, CommandRequest.class);
                if (!node.hasNonNull("issued_by")) {
                    request = new CommandRequest(request.getDeviceId(), request.getCommandType(),
                            request.getParameters(), defaultIssuer);
                }
                return ReplayMessage.command(request);
            }
            case "command_result":
                return ReplayMessage.executionResult(requireId(node, "command_id"),
                        node.path("success").asBoolean(false),
                        node.hasNonNull("detail") ? node.get("detail").asText() : null);
            case "acknowledge":
                return ReplayMessage.acknowledge(requireId(node, "alarm_id"),
                        node.hasNonNull("operator") ? node.get("operator").asText() : defaultIssuer);
            default:
                throw new IllegalArgumentException("Unknown replay message type '" + type + "'");
        }
    }

    private static long requireId(JsonNode node, String field) {
        JsonNode id = node.get(field);
        if (id == null || !id.canConvertToLong()) {
            throw new IllegalArgumentException("Missing or non-integer '" + field + "'");
        }
        return id.asLong();
    }

    private static String abbreviate(String line) {
        return line.length() <= 120 ? line : line.substring(0, 117) + "...";
    }
}
