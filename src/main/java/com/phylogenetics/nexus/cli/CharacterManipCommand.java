package com.phylogenetics.nexus.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.cli.exception.OptionsValidationException;
import com.phylogenetics.nexus.cli.model.CharacterManipOptions;
import com.phylogenetics.nexus.cli.model.ValidatedCharacterManipOptions;
import com.phylogenetics.nexus.cli.output.StatisticsPrinter;
import com.phylogenetics.nexus.cli.validation.CharacterManipOptionsValidator;
import com.phylogenetics.nexus.handler.DataHandler;
import com.phylogenetics.nexus.model.NexusDocument;
import com.phylogenetics.nexus.parser.NexusReader;
import com.phylogenetics.nexus.tools.CharacterAnalyzer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command for reporting on and removing sites of a character matrix.
 */
@Command(
        name = "manip",
        mixinStandardHelpOptions = true,
        description = "Reports on the sites of a data/characters block and removes selected sites."
)
public class CharacterManipCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CharacterManipCommand.class);

    @Mixin
    private CharacterManipOptions options;

    @Spec
    private CommandSpec spec;

    private final CharacterManipOptionsValidator validator = new CharacterManipOptionsValidator();
    private final StatisticsPrinter printer = new StatisticsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedCharacterManipOptions validated = validator.validate(options);

            NexusDocument document = new NexusReader().read(options.getInput());
            DataHandler data = document.getData();
            if (data == null) {
                log.error("No data or characters block in {}", options.getInput());
                return 1;
            }

            PrintWriter out = spec.commandLine().getOut();

            if (options.isNumber()) {
                List<String> states = CharacterAnalyzer.DEFAULT_COUNTED_STATES;
                printer.printSiteValues(out, options.getInput().toString(), states,
                        CharacterAnalyzer.countSiteValues(data, states));
            }
            if (options.isStats()) {
                printer.printCharacterStats(out, CharacterAnalyzer.tallyStates(data));
            }
            if (validated.isReportOnly()) {
                return 0;
            }

            Set<Integer> doomed = new TreeSet<>();
            if (options.isConstant()) {
                doomed.addAll(report(out, "Constant Sites", CharacterAnalyzer.findConstantSites(data)));
            }
            if (options.isUnique()) {
                doomed.addAll(report(out, "Unique Sites", CharacterAnalyzer.findUniqueSites(data)));
            }
            if (options.isZeros()) {
                doomed.addAll(report(out, "Zero Sites", CharacterAnalyzer.findZeroSites(data)));
            }
            if (!validated.getSitesToRemove().isEmpty()) {
                doomed.addAll(report(out, "Remove", validated.getSitesToRemove()));
            }

            CharacterAnalyzer.removeSites(document, doomed);

            if (options.getOutput() != null) {
                document.writeToFile(options.getOutput());
                out.println("New nexus written to " + options.getOutput());
                out.flush();
            }
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (Exception e) {
            log.error("manip failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private List<Integer> report(PrintWriter out, String label, List<Integer> sites) throws IOException {
        printer.printSites(out, label, sites);
        return sites;
    }
}
