package com.phylogenetics.nexus.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.phylogenetics.nexus.cli.exception.OptionsValidationException;
import com.phylogenetics.nexus.cli.model.CharacterManipOptions;
import com.phylogenetics.nexus.cli.model.ValidatedCharacterManipOptions;
import com.phylogenetics.nexus.exception.ValueParseException;
import com.phylogenetics.nexus.tools.RangeParser;

public class CharacterManipOptionsValidator {

    public ValidatedCharacterManipOptions validate(CharacterManipOptions o) {
        List<String> errors = new ArrayList<>();

        checkInput(o.getInput(), errors);

        boolean reportOnly = o.isNumber() || o.isStats();
        boolean removing = o.isConstant() || o.isUnique() || o.isZeros() || o.getRemove() != null;
        if (!reportOnly && !removing) {
            errors.add("Nothing to do: give at least one of -n, -s, -c, -u, -z or -x.");
        }

        List<Integer> sites = new ArrayList<>();
        if (o.getRemove() != null) {
            try {
                for (int site : RangeParser.parse(o.getRemove())) {
                    if (site < 1) {
                        errors.add("Site numbers start at 1. Got: " + site);
                        break;
                    }
                    sites.add(site - 1);
                }
            } catch (ValueParseException e) {
                errors.add("Invalid --remove range: " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException("manip", errors);
        }
        return new ValidatedCharacterManipOptions(sites, reportOnly);
    }

    static void checkInput(Path input, List<String> errors) {
        if (input == null) {
            errors.add("An input file is required.");
        } else if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
            errors.add("Input file does not exist or is not readable: " + input);
        }
    }
}
