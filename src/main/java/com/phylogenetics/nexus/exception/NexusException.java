package com.phylogenetics.nexus.exception;

/**
 * Base type for every error raised while reading, writing or manipulating NEXUS data.
 */
public class NexusException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NexusException(String message) {
        super(message);
    }

    public NexusException(String message, Throwable cause) {
        super(message, cause);
    }
}
