package com.gsesentinel.core.command;

/**
 * Why a command was not admitted.
 *
 * @since 1.0.0
 */
public enum RejectionReason {
    UNKNOWN_DEVICE,
    UNSUPPORTED_COMMAND,
    INVALID_PARAMETER,
    EMERGENCY_SHUTDOWN_ACTIVE,
    INTERLOCK_VIOLATION
}
