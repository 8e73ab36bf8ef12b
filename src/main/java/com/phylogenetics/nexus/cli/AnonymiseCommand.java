package com.phylogenetics.nexus.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.model.NexusDocument;
import com.phylogenetics.nexus.parser.NexusReader;
import com.phylogenetics.nexus.tools.Anonymiser;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * CLI command for replacing taxon names with salted hashes.
 */
@Command(
        name = "anonymise",
        mixinStandardHelpOptions = true,
        description = "Replaces every taxon name in a NEXUS file with a salted MD5 hash."
)
public class AnonymiseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnonymiseCommand.class);

    @Parameters(index = "0", paramLabel = "INPUT", description = "NEXUS file to read")
    private Path input;

    @Parameters(index = "1", arity = "0..1", paramLabel = "OUTPUT", description = "File to write the anonymised document to")
    private Path output;

    @Option(names = { "--salt" }, description = "Salt for the hashes (random when omitted)")
    private String salt;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        if (!Files.isRegularFile(input)) {
            log.error("Input file does not exist: {}", input);
            return 1;
        }
        try {
            NexusDocument document = Anonymiser.anonymise(new NexusReader().read(input), salt);

            PrintWriter out = spec.commandLine().getOut();
            if (output != null) {
                document.writeToFile(output);
                out.println("Anonymised nexus written to " + output);
            } else {
                out.print(document.write());
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.error("anonymise failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
