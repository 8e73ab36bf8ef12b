package com.phylogenetics.nexus;

import com.phylogenetics.nexus.cli.NexusCommand;

import picocli.CommandLine;

/**
 * Main entry point for the nexus-tools command line.
 * Subcommands read a NEXUS file, report on or edit it, and optionally write the result.
 */
public class NexusToolsApplication {

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new NexusCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
