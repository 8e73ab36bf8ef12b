package com.phylogenetics.nexus.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.cli.exception.OptionsValidationException;
import com.phylogenetics.nexus.cli.model.TreeManipOptions;
import com.phylogenetics.nexus.cli.model.ValidatedTreeManipOptions;
import com.phylogenetics.nexus.cli.validation.TreeManipOptionsValidator;
import com.phylogenetics.nexus.handler.TreesHandler;
import com.phylogenetics.nexus.model.NexusDocument;
import com.phylogenetics.nexus.parser.NexusReader;
import com.phylogenetics.nexus.tools.TreeManipulator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command for thinning and cleaning up a trees block.
 *
 * Edits run in a fixed order: delete, resample, random sample, strip comments,
 * detranslate. Without an output file the edited document goes to stdout.
 */
@Command(
        name = "treemanip",
        mixinStandardHelpOptions = true,
        description = "Deletes, resamples, samples and cleans up the trees of a NEXUS tree file."
)
public class TreeManipCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TreeManipCommand.class);

    @Mixin
    private TreeManipOptions options;

    @Spec
    private CommandSpec spec;

    private final TreeManipOptionsValidator validator = new TreeManipOptionsValidator();

    @Override
    public Integer call() {
        try {
            ValidatedTreeManipOptions validated = validator.validate(options);

            NexusDocument document = new NexusReader().read(options.getInput());
            TreesHandler trees = document.getTrees();
            if (trees == null) {
                log.error("No trees block in {}", options.getInput());
                return 1;
            }
            log.info("Read {} trees from {}", trees.getNtrees(), options.getInput());

            if (!validated.getTreesToDelete().isEmpty()) {
                TreeManipulator.deleteTrees(trees, validated.getTreesToDelete());
            }
            if (options.getResample() != null) {
                TreeManipulator.resample(trees, options.getResample());
            }
            if (options.getRandom() != null) {
                TreeManipulator.randomSample(trees, options.getRandom(), validated.getRandom());
            }
            if (options.isRemoveComments()) {
                TreeManipulator.removeComments(trees);
            }
            if (options.isDetranslate()) {
                TreeManipulator.detranslate(trees);
            }
            log.info("{} trees remain", trees.getNtrees());

            PrintWriter out = spec.commandLine().getOut();
            if (options.getOutput() != null) {
                document.writeToFile(options.getOutput());
                out.println("New nexus with " + trees.getNtrees() + " trees written to " + options.getOutput());
            } else {
                out.print(document.write());
            }
            out.flush();
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (Exception e) {
            log.error("treemanip failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
