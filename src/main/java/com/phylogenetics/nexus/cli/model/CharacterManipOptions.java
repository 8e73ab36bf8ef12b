package com.phylogenetics.nexus.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds the CLI options for the "manip" command. No validation or execution logic.
 */
@Getter
public class CharacterManipOptions {

    @Parameters(index = "0", paramLabel = "INPUT", description = "NEXUS file to read")
    private Path input;

    @Parameters(index = "1", arity = "0..1", paramLabel = "OUTPUT", description = "File to write the edited matrix to")
    private Path output;

    @Option(names = { "--number", "-n" }, description = "Count gap and missing states per taxon")
    private boolean number;

    @Option(names = { "--stats", "-s" }, description = "Print character-by-character state tallies")
    private boolean stats;

    @Option(names = { "--constant", "-c" }, description = "Find (and remove) constant sites")
    private boolean constant;

    @Option(names = { "--unique", "-u" }, description = "Find (and remove) sites unique to one taxon")
    private boolean unique;

    @Option(names = { "--zeros", "-z" }, description = "Find (and remove) sites with no present states")
    private boolean zeros;

    @Option(names = { "--remove", "-x" }, paramLabel = "RANGE", description = "Remove sites by 1-based range, e.g. 1,3,5-8")
    private String remove;
}
