package com.phylogenetics.nexus.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds the CLI options for the "treemanip" command. No validation or execution logic.
 */
@Getter
public class TreeManipOptions {

    @Parameters(index = "0", paramLabel = "INPUT", description = "NEXUS tree file to read")
    private Path input;

    @Parameters(index = "1", arity = "0..1", paramLabel = "OUTPUT", description = "File to write the edited trees to")
    private Path output;

    @Option(names = { "--deltree", "-d" }, paramLabel = "RANGE", description = "Delete trees by 1-based range, e.g. 1,3,5-8")
    private String deltree;

    @Option(names = { "--resample", "-r" }, paramLabel = "N", description = "Keep every N-th tree")
    private Integer resample;

    @Option(names = { "--random", "-n" }, paramLabel = "N", description = "Keep N randomly chosen trees")
    private Integer random;

    @Option(names = { "--removecomments", "-c" }, description = "Strip [...] comments from the trees")
    private boolean removeComments;

    @Option(names = { "--detranslate", "-t" }, description = "Replace translated labels with taxon names")
    private boolean detranslate;

    @Option(names = { "--seed" }, description = "Seed for --random, for repeatable samples")
    private Long seed;
}
