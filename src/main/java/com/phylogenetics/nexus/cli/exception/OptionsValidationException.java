package com.phylogenetics.nexus.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * Carries every validation error found in one pass over the options of a subcommand.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String command;
    private final List<String> errors;

    public OptionsValidationException(String command, List<String> errors) {
        super("Invalid options for '" + command + "': " + String.join("; ", errors));
        this.command = command;
        this.errors = List.copyOf(errors);
    }
}
