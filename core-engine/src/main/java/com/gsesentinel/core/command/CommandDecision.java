package com.gsesentinel.core.command;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Outcome of a command submission: admitted with an id, or rejected with a
 * reason and an operator-facing detail message.
 *
 * @since 1.0.0
 */
public final class CommandDecision {

    private final long commandId;
    private final RejectionReason reason;
    private final String detail;

    private CommandDecision(long commandId, RejectionReason reason, String detail) {
        this.commandId = commandId;
        this.reason = reason;
        this.detail = detail;
    }

    public static CommandDecision admitted(long commandId) {
        return new CommandDecision(commandId, null, null);
    }

    public static CommandDecision rejected(RejectionReason reason, String detail) {
        return new CommandDecision(CommandRecord.UNASSIGNED,
                Objects.requireNonNull(reason, "RejectionReason must not be null"), detail);
    }

    public boolean isAdmitted() {
        return reason == null;
    }

    /**
     * @return the ledger id of an admitted command, empty for rejections
     */
    public OptionalLong getCommandId() {
        return isAdmitted() ? OptionalLong.of(commandId) : OptionalLong.empty();
    }

    /**
     * @return rejection reason, {@code null} when admitted
     */
    public RejectionReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommandDecision that)) return false;
        return commandId == that.commandId && reason == that.reason && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commandId, reason, detail);
    }

    @Override
    public String toString() {
        return isAdmitted()
                ? "Admitted{commandId=" + commandId + '}'
                : "Rejected{reason=" + reason + ", detail='" + detail + "'}";
    }
}
