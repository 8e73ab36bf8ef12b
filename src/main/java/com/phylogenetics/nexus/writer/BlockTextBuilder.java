package com.phylogenetics.nexus.writer;

import java.util.List;

/**
 * Accumulates the text of one {@code begin ...; end;} block.
 */
public class BlockTextBuilder {

    public static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private boolean ended;

    public BlockTextBuilder(String blockName) {
        sb.append("begin ").append(blockName).append(";\n");
    }

    /**
     * Unparsed declarations (TITLE, LINK, ...) are written back verbatim and in order.
     */
    public BlockTextBuilder attributes(List<String> attributes) {
        for (String attribute : attributes) {
            statement(attribute);
        }
        return this;
    }

    /** Indented line. */
    public BlockTextBuilder statement(String text) {
        sb.append(INDENT).append(text).append('\n');
        return this;
    }

    /** Line written at column 0. */
    public BlockTextBuilder line(String text) {
        sb.append(text).append('\n');
        return this;
    }

    public String end() {
        if (!ended) {
            sb.append("end;\n");
            ended = true;
        }
        return sb.toString();
    }
}
