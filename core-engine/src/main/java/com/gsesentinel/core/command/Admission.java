package com.gsesentinel.core.command;

/**
 * Result of {@link CommandValidator#validate}: either the decoded command
 * or the reason it was turned away.
 *
 * @since 1.0.0
 */
public final class Admission {

    private final CommandType commandType;
    private final CommandParameters parameters;
    private final RejectionReason reason;
    private final String detail;

    private Admission(CommandType commandType, CommandParameters parameters, RejectionReason reason,
            String detail) {
        this.commandType = commandType;
        this.parameters = parameters;
        this.reason = reason;
        this.detail = detail;
    }

    static Admission admit(CommandType commandType, CommandParameters parameters) {
        return new Admission(commandType, parameters, null, null);
    }

    static Admission reject(RejectionReason reason, String detail) {
        return new Admission(null, null, reason, detail);
    }

    public boolean isAdmitted() {
        return reason == null;
    }

    /**
     * @return decoded command type, {@code null} for rejections
     */
    public CommandType getCommandType() {
        return commandType;
    }

    public CommandParameters getParameters() {
        return parameters;
    }

    public RejectionReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return isAdmitted()
                ? "Admission{" + commandType + ' ' + parameters + '}'
                : "Admission{rejected " + reason + ": " + detail + '}';
    }
}
