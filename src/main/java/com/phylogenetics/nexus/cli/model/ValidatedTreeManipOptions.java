package com.phylogenetics.nexus.cli.model;

import java.util.List;
import java.util.Random;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values for the "treemanip" command.
 */
@Data
@AllArgsConstructor
public class ValidatedTreeManipOptions {
    /** 1-based tree positions named by --deltree. */
    List<Integer> treesToDelete;
    Random random;
}
