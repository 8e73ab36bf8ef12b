package com.phylogenetics.nexus.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level "nexus-tools" command. Does nothing by itself except print usage.
 */
@Command(
        name = "nexus-tools",
        mixinStandardHelpOptions = true,
        version = "nexus-tools 1.0.0",
        description = "Reads, reports on and edits NEXUS phylogenetics files.",
        subcommands = {
                CharacterManipCommand.class,
                TreeManipCommand.class,
                AnonymiseCommand.class,
                HelpCommand.class
        }
)
public class NexusCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
