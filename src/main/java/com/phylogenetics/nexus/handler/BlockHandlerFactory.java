package com.phylogenetics.nexus.handler;

/**
 * Creates an empty handler for a block name found in a file.
 */
@FunctionalInterface
public interface BlockHandlerFactory {

    BlockHandler create(String blockName);
}
