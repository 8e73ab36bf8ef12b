package com.phylogenetics.nexus.handler;

/**
 * Handler for {@code characters} blocks.
 *
 * Same matrix model as {@link DataHandler}, but ntax may be left out of the
 * dimensions statement when the taxa come from a linked taxa block; it is then
 * taken from the matrix and not written back.
 */
public class CharactersHandler extends DataHandler {

    public CharactersHandler(String blockName) {
        super(blockName);
    }

    public CharactersHandler() {
        this("characters");
    }

    @Override
    protected boolean requiresNtax() {
        return false;
    }

    @Override
    protected String dimensionsStatement() {
        if (isNtaxDeclared()) {
            return super.dimensionsStatement();
        }
        return "dimensions nchar=" + getNchar() + ";";
    }
}
