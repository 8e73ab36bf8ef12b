package com.phylogenetics.nexus.exception;

/**
 * Thrown when a numeric value or range expression cannot be parsed.
 */
public class ValueParseException extends NexusException {

    private static final long serialVersionUID = 1L;

    public ValueParseException(String message) {
        super(message);
    }

    public ValueParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
