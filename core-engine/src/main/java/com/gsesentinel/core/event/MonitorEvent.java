package com.gsesentinel.core.event;

import com.gsesentinel.core.command.CommandRecord;
import com.gsesentinel.core.model.Alarm;
import com.gsesentinel.core.model.DeviceState;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * An alarm, device-state or command transition, handed to the
 * {@link MonitorEventSink} for persistence and display.
 *
 * <p>
 * Exactly one payload is set depending on the type: {@code alarm} for
 * {@code ALARM_*}, {@code previousState}/{@code deviceState} for
 * {@code DEVICE_STATE_CHANGED}, {@code command} for {@code COMMAND_*}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final MonitorEventType type;
    private final Instant timestamp;
    private final String deviceId;
    private final String description;
    private final Alarm alarm;
    private final DeviceState previousState;
    private final DeviceState deviceState;
    private final CommandRecord command;

    private MonitorEvent(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId must not be null");
        this.description = builder.description;
        this.alarm = builder.alarm;
        this.previousState = builder.previousState;
        this.deviceState = builder.deviceState;
        this.command = builder.command;
    }

    /**
     * @param type alarm event type
     * @param at   event time
     * @param alarm alarm snapshot after the transition
     * @return new alarm event
     */
    public static MonitorEvent ofAlarm(MonitorEventType type, Instant at, Alarm alarm) {
        return builder()
                .type(type)
                .timestamp(at)
                .deviceId(alarm.getDeviceId())
                .alarm(alarm)
                .description(alarm.getType() + " " + alarm.getSeverity() + " on " + alarm.getParameter()
                        + " (alarm " + alarm.getId() + ")")
                .build();
    }

    /**
     * @param at     event time
     * @param before state before the transition
     * @param after  state after the transition
     * @param cause  what drove the transition
     * @return new device-state event
     */
    public static MonitorEvent ofStateChange(Instant at, DeviceState before, DeviceState after, String cause) {
        return builder()
                .type(MonitorEventType.DEVICE_STATE_CHANGED)
                .timestamp(at)
                .deviceId(after.getDeviceId())
                .previousState(before)
                .deviceState(after)
                .description(before.getMode() + "/" + before.getStatus() + " -> "
                        + after.getMode() + "/" + after.getStatus() + " (" + cause + ")")
                .build();
    }

    /**
     * @param type    command event type
     * @param at      event time
     * @param command command snapshot after the transition
     * @return new command event
     */
    public static MonitorEvent ofCommand(MonitorEventType type, Instant at, CommandRecord command) {
        String description = "Command " + command.getCommandType() + " " + command.getStatus()
                + " by " + command.getIssuedBy();
        if (command.getDetail() != null) {
            description += ": " + command.getDetail();
        }
        return builder()
                .type(type)
                .timestamp(at)
                .deviceId(command.getDeviceId())
                .command(command)
                .description(description)
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MonitorEvent}. {@code type}, {@code timestamp}
     * and {@code deviceId} are required.
     */
    public static class Builder {
        private MonitorEventType type;
        private Instant timestamp;
        private String deviceId;
        private String description;
        private Alarm alarm;
        private DeviceState previousState;
        private DeviceState deviceState;
        private CommandRecord command;

        public Builder type(MonitorEventType type) {
            this.type = type;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder alarm(Alarm alarm) {
            this.alarm = alarm;
            return this;
        }

        public Builder previousState(DeviceState previousState) {
            this.previousState = previousState;
            return this;
        }

        public Builder deviceState(DeviceState deviceState) {
            this.deviceState = deviceState;
            return this;
        }

        public Builder command(CommandRecord command) {
            this.command = command;
            return this;
        }

        public MonitorEvent build() {
            return new MonitorEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public MonitorEventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getDescription() {
        return description;
    }

    public Alarm getAlarm() {
        return alarm;
    }

    public DeviceState getPreviousState() {
        return previousState;
    }

    public DeviceState getDeviceState() {
        return deviceState;
    }

    public CommandRecord getCommand() {
        return command;
    }

    @Override
    public String toString() {
        return "MonitorEvent{" +
                "type=" + type +
                ", timestamp=" + timestamp +
                ", deviceId='" + deviceId + '\'' +
                ", description='" + description + '\'' +
                '}';
    }
}
