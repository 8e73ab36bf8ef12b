package com.phylogenetics.nexus.cli.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.phylogenetics.nexus.cli.exception.OptionsValidationException;
import com.phylogenetics.nexus.cli.model.TreeManipOptions;
import com.phylogenetics.nexus.cli.model.ValidatedTreeManipOptions;
import com.phylogenetics.nexus.exception.ValueParseException;
import com.phylogenetics.nexus.tools.RangeParser;

public class TreeManipOptionsValidator {

    public ValidatedTreeManipOptions validate(TreeManipOptions o) {
        List<String> errors = new ArrayList<>();

        CharacterManipOptionsValidator.checkInput(o.getInput(), errors);

        if (o.getDeltree() == null && o.getResample() == null && o.getRandom() == null
                && !o.isRemoveComments() && !o.isDetranslate()) {
            errors.add("Nothing to do: give at least one of -d, -r, -n, -c or -t.");
        }

        if (o.getResample() != null && o.getResample() < 1) {
            errors.add("--resample must be >= 1. Got: " + o.getResample());
        }
        if (o.getRandom() != null && o.getRandom() < 1) {
            errors.add("--random must be >= 1. Got: " + o.getRandom());
        }
        if (o.getSeed() != null && o.getRandom() == null) {
            errors.add("--seed only applies together with --random.");
        }

        List<Integer> trees = List.of();
        if (o.getDeltree() != null) {
            try {
                trees = RangeParser.parse(o.getDeltree());
            } catch (ValueParseException e) {
                errors.add("Invalid --deltree range: " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException("treemanip", errors);
        }

        Random random = o.getSeed() != null ? new Random(o.getSeed()) : new Random();
        return new ValidatedTreeManipOptions(trees, random);
    }
}
