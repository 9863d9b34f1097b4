package com.gsesentinel.app;

import com.gsesentinel.core.model.CommandRequest;
import com.gsesentinel.core.model.TelemetryPoint;

import java.util.Objects;

/**
 * One decoded line of replay input.
 *
 * @since 1.0.0
 */
public final class ReplayMessage {

    /** What the line asks the monitor to do. */
    public enum Kind {
        TELEMETRY,
        COMMAND,
        EXECUTION_RESULT,
        ACKNOWLEDGE
    }

    private final Kind kind;
    private final TelemetryPoint telemetry;
    private final CommandRequest command;
    private final long targetId;
    private final boolean success;
    private final String detail;
    private final String operator;

    private ReplayMessage(Kind kind, TelemetryPoint telemetry, CommandRequest command, long targetId,
            boolean success, String detail, String operator) {
        this.kind = kind;
        this.telemetry = telemetry;
        this.command = command;
        this.targetId = targetId;
        this.success = success;
        this.detail = detail;
        this.operator = operator;
    }

    public static ReplayMessage telemetry(TelemetryPoint point) {
        return new ReplayMessage(Kind.TELEMETRY, Objects.requireNonNull(point), null, 0, false, null, null);
    }

    public static ReplayMessage command(CommandRequest request) {
        return new ReplayMessage(Kind.COMMAND, null, Objects.requireNonNull(request), 0, false, null, null);
    }

    public static ReplayMessage executionResult(long commandId, boolean success, String detail) {
        return new ReplayMessage(Kind.EXECUTION_RESULT, null, null, commandId, success, detail, null);
    }

    public static ReplayMessage acknowledge(long alarmId, String operator) {
        return new ReplayMessage(Kind.ACKNOWLEDGE, null, null, alarmId, false, null,
                Objects.requireNonNull(operator));
    }

    public Kind getKind() {
        return kind;
    }

    public TelemetryPoint getTelemetry() {
        return telemetry;
    }

    public CommandRequest getCommand() {
        return command;
    }

    /**
     * @return command id for execution results, alarm id for acknowledgments
     */
    public long getTargetId() {
        return targetId;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getDetail() {
        return detail;
    }

    public String getOperator() {
        return operator;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TELEMETRY -> "ReplayMessage{" + telemetry + '}';
            case COMMAND -> "ReplayMessage{" + command + '}';
            case EXECUTION_RESULT -> "ReplayMessage{result command=" + targetId + " success=" + success + '}';
            case ACKNOWLEDGE -> "ReplayMessage{ack alarm=" + targetId + " by " + operator + '}';
        };
    }
}
