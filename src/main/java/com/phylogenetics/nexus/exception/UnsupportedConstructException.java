package com.phylogenetics.nexus.exception;

/**
 * Thrown for NEXUS constructs that are recognised but deliberately not handled,
 * such as charstatelabels.
 */
public class UnsupportedConstructException extends NexusException {

    private static final long serialVersionUID = 1L;

    public UnsupportedConstructException(String message) {
        super(message);
    }
}
