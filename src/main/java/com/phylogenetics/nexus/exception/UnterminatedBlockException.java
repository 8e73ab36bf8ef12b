package com.phylogenetics.nexus.exception;

/**
 * Thrown when a block is still open at end of input (or when the next block begins).
 */
public class UnterminatedBlockException extends NexusException {

    private static final long serialVersionUID = 1L;

    public UnterminatedBlockException(String blockName, int openedAtLine) {
        super("Block '" + blockName + "' opened at line " + openedAtLine + " is never closed with 'end;'");
    }
}
