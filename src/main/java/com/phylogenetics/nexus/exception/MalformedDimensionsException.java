package com.phylogenetics.nexus.exception;

/**
 * Thrown when a dimensions statement lacks a required ntax or nchar value.
 */
public class MalformedDimensionsException extends NexusException {

    private static final long serialVersionUID = 1L;

    public MalformedDimensionsException(String blockName, String missing, String line) {
        super("Missing " + missing + " in dimensions of block '" + blockName + "': " + line);
    }
}
