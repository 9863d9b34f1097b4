package com.gsesentinel.core.command;

import java.util.NoSuchElementException;

/**
 * Thrown when a command id is not in the ledger.
 *
 * @since 1.0.0
 */
public class CommandNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final long commandId;

    public CommandNotFoundException(long commandId) {
        super("Unknown command id: " + commandId);
        this.commandId = commandId;
    }

    public long getCommandId() {
        return commandId;
    }
}
