package com.phylogenetics.nexus.handler;

import java.util.List;

/**
 * One parsed {@code begin <name>; ... end;} block.
 *
 * A handler owns the structured state of its block: {@link #parse(List)} fills it
 * from the raw block lines and {@link #write()} renders it back as NEXUS text.
 * Handlers never reference each other.
 */
public interface BlockHandler {

    /**
     * Block name used when writing, e.g. "data" or "characters".
     */
    String getBlockName();

    /**
     * Populate this handler from the lines between the begin and end statements.
     */
    void parse(List<String> lines);

    /**
     * Render this block as NEXUS text, ending with {@code end;} and a newline.
     */
    String write();
}
