package com.phylogenetics.nexus.parser;

import java.util.List;

import lombok.Value;

/**
 * The unparsed lines of one {@code begin ...; end;} region, in file order.
 * The begin and end lines themselves are not included.
 */
@Value
public class RawBlock {
    /** Block name as written in the file. */
    String name;
    int startLine;
    List<String> lines;
}
