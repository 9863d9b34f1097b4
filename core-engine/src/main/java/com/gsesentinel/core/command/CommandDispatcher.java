package com.gsesentinel.core.command;

/**
 * Hands admitted commands to the equipment. Implementations report the outcome
 * later through the monitor's execution-result call.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandDispatcher {

    /** Dispatcher that drops every command. */
    CommandDispatcher NONE = command -> { };

    /**
     * @param command the admitted command
     */
    void dispatch(CommandRecord command);
}
