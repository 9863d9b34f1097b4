package com.gsesentinel.core.command;

/**
 * Thrown by {@link CommandParameterDecoder} when a required parameter is
 * missing, has the wrong type or is out of range.
 *
 * @since 1.0.0
 */
public class InvalidCommandParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public InvalidCommandParameterException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return name of the offending parameter
     */
    public String getField() {
        return field;
    }
}
