package com.phylogenetics.nexus.cli.model;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values for the "manip" command.
 */
@Data
@AllArgsConstructor
public class ValidatedCharacterManipOptions {
    /** 0-based sites named by --remove. */
    List<Integer> sitesToRemove;
    boolean reportOnly;
}
