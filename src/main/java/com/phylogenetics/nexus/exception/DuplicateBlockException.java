package com.phylogenetics.nexus.exception;

/**
 * Thrown when the same block name is opened twice in one file.
 */
public class DuplicateBlockException extends NexusException {

    private static final long serialVersionUID = 1L;
    private final String blockName;

    public DuplicateBlockException(String blockName, int line) {
        super("Duplicate block '" + blockName + "' at line " + line);
        this.blockName = blockName;
    }

    public String getBlockName() {
        return blockName;
    }
}
