package com.gsesentinel.core.command;

/**
 * Command lifecycle: SUBMITTED, then ADMITTED or REJECTED, then for admitted
 * commands EXECUTED or FAILED once the equipment reports back.
 *
 * @since 1.0.0
 */
public enum CommandStatus {
    SUBMITTED,
    ADMITTED,
    REJECTED,
    EXECUTED,
    FAILED;

    /**
     * @return {@code true} for states no further transition leaves
     */
    public boolean isTerminal() {
        return this == REJECTED || this == EXECUTED || this == FAILED;
    }
}
