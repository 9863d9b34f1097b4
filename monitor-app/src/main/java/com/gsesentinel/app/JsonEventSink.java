package com.gsesentinel.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gsesentinel.core.command.CommandRecord;
import com.gsesentinel.core.event.MonitorEvent;
import com.gsesentinel.core.event.MonitorEventSink;
import com.gsesentinel.core.model.Alarm;
import com.gsesentinel.core.model.DeviceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MonitorEventSink} that writes each event as one JSON line.
 *
 * <p>
 * Write failures are rethrown so the monitor reports them as undelivered.
 * </p>
 */
public class JsonEventSink implements MonitorEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonEventSink.class);

    private final Writer out;
    private final ObjectMapper mapper;

    public JsonEventSink(Writer out) {
        this.out = Objects.requireNonNull(out, "Writer must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Override
    public void publish(MonitorEvent event) {
        String json = toJson(event);
        synchronized (out) {
            try {
                out.write(json);
                out.write(System.lineSeparator());
                out.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + event.getType() + " event", e);
            }
        }
    }

    /**
     * @param event monitor event
     * @return single-line JSON rendering
     */
    String toJson(MonitorEvent event) {
        try {
            return mapper.writeValueAsString(view(event));
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {} event: {}", event.getType(), e.getMessage(), e);
            throw new IllegalStateException("Unserializable event " + event.getType(), e);
        }
    }

    // ---------------------------------------------------------------
    // Views
    // ---------------------------------------------------------------

    private static Map<String, Object> view(MonitorEvent event) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("event", event.getType().name());
        map.put("timestamp", event.getTimestamp());
        map.put("device_id", event.getDeviceId());
        map.put("description", event.getDescription());
        if (event.getAlarm() != null) {
            map.put("alarm", view(event.getAlarm()));
        }
        if (event.getPreviousState() != null) {
            map.put("previous_state", view(event.getPreviousState()));
        }
        if (event.getDeviceState() != null) {
            map.put("device_state", view(event.getDeviceState()));
        }
        if (event.getCommand() != null) {
            map.put("command", view(event.getCommand()));
        }
        return map;
    }

    private static Map<String, Object> view(Alarm alarm) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", alarm.getId());
        map.put("parameter", alarm.getParameter());
        map.put("type", alarm.getType().name());
        map.put("severity", alarm.getSeverity().name());
        map.put("state", alarm.getState().name());
        map.put("threshold_value", alarm.getThresholdValue());
        map.put("actual_value", alarm.getActualValue());
        map.put("triggered_at", alarm.getTriggeredAt());
        map.put("acknowledged", alarm.isAcknowledged());
        map.put("acknowledged_by", alarm.getAcknowledgedBy());
        map.put("acknowledged_at", alarm.getAcknowledgedAt());
        map.put("cleared_at", alarm.getClearedAt());
        map.put("duration_seconds", alarm.getDuration().map(d -> d.toMillis() / 1000.0).orElse(null));
        return map;
    }

    private static Map<String, Object> view(DeviceState state) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("device_type", state.getDeviceType().getCode());
        map.put("mode", state.getMode().name());
        map.put("status", state.getStatus().name());
        map.put("last_command", state.getLastCommand());
        map.put("last_command_at", state.getLastCommandAt());
        return map;
    }

    private static Map<String, Object> view(CommandRecord command) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", command.hasId() ? command.getId() : null);
        map.put("command_type", command.getCommandType());
        map.put("parameters", command.getParameters().toString());
        map.put("issued_by", command.getIssuedBy());
        map.put("status", command.getStatus().name());
        map.put("rejection_reason", command.getRejectionReason() != null
                ? command.getRejectionReason().name() : null);
        map.put("detail", command.getDetail());
        map.put("submitted_at", command.getSubmittedAt());
        map.put("completed_at", command.getCompletedAt());
        return map;
    }
}
