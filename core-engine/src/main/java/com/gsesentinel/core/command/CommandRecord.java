package com.gsesentinel.core.command;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a command as held by the {@link CommandLedger}.
 * Rejected commands carry no id ({@link #UNASSIGNED}).
 *
 * @since 1.0.0
 */
public final class CommandRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Id of commands that were never admitted. */
    public static final long UNASSIGNED = 0L;

    private final long id;
    private final String deviceId;
    private final String commandType;
    private final CommandParameters parameters;
    private final String issuedBy;
    private final Instant submittedAt;
    private final CommandStatus status;
    private final RejectionReason rejectionReason;
    private final String detail;
    private final Instant completedAt;

    private CommandRecord(Builder b) {
        this.id = b.id;
        this.deviceId = Objects.requireNonNull(b.deviceId, "deviceId must not be null");
        this.commandType = Objects.requireNonNull(b.commandType, "commandType must not be null");
        this.parameters = b.parameters == null ? CommandParameters.None.INSTANCE : b.parameters;
        this.issuedBy = b.issuedBy;
        this.submittedAt = Objects.requireNonNull(b.submittedAt, "submittedAt must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.rejectionReason = b.rejectionReason;
        this.detail = b.detail;
        this.completedAt = b.completedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this record's fields
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .deviceId(deviceId)
                .commandType(commandType)
                .parameters(parameters)
                .issuedBy(issuedBy)
                .submittedAt(submittedAt)
                .status(status)
                .rejectionReason(rejectionReason)
                .detail(detail)
                .completedAt(completedAt);
    }

    public static class Builder {
        private long id = UNASSIGNED;
        private String deviceId;
        private String commandType;
        private CommandParameters parameters;
        private String issuedBy;
        private Instant submittedAt;
        private CommandStatus status = CommandStatus.SUBMITTED;
        private RejectionReason rejectionReason;
        private String detail;
        private Instant completedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder commandType(String commandType) {
            this.commandType = commandType;
            return this;
        }

        public Builder parameters(CommandParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder issuedBy(String issuedBy) {
            this.issuedBy = issuedBy;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder status(CommandStatus status) {
            this.status = status;
            return this;
        }

        public Builder rejectionReason(RejectionReason rejectionReason) {
            this.rejectionReason = rejectionReason;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public CommandRecord build() {
            return new CommandRecord(this);
        }
    }

    public long getId() {
        return id;
    }

    public boolean hasId() {
        return id != UNASSIGNED;
    }

    public String getDeviceId() {
        return deviceId;
    }

    /**
     * @return wire code of the command as submitted
     */
    public String getCommandType() {
        return commandType;
    }

    public CommandParameters getParameters() {
        return parameters;
    }

    public String getIssuedBy() {
        return issuedBy;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public CommandStatus getStatus() {
        return status;
    }

    /**
     * @return reason of a rejection, {@code null} otherwise
     */
    public RejectionReason getRejectionReason() {
        return rejectionReason;
    }

    /**
     * @return rejection message or execution detail, may be {@code null}
     */
    public String getDetail() {
        return detail;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommandRecord that)) return false;
        return id == that.id
                && deviceId.equals(that.deviceId)
                && commandType.equals(that.commandType)
                && Objects.equals(parameters, that.parameters)
                && Objects.equals(issuedBy, that.issuedBy)
                && submittedAt.equals(that.submittedAt)
                && status == that.status
                && rejectionReason == that.rejectionReason
                && Objects.equals(detail, that.detail)
                && Objects.equals(completedAt, that.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, deviceId, commandType, status);
    }

    @Override
    public String toString() {
        return "CommandRecord{" +
                "id=" + id +
                ", deviceId='" + deviceId + '\'' +
                ", commandType='" + commandType + '\'' +
                ", parameters=" + parameters +
                ", status=" + status +
                (rejectionReason != null ? ", rejectionReason=" + rejectionReason : "") +
                (detail != null ? ", detail='" + detail + '\'' : "") +
                '}';
    }
}
