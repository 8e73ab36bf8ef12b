package com.phylogenetics.nexus.tools;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.handler.TreesHandler;

/**
 * In-place edits of a trees block: deletion, thinning, random sampling and cleanup.
 */
public class TreeManipulator {
    private static final Logger log = LoggerFactory.getLogger(TreeManipulator.class);

    private TreeManipulator() {
        // Utility class
    }

    /**
     * Delete trees by 1-based position.
     */
    public static void deleteTrees(TreesHandler trees, Collection<Integer> positions) {
        List<String> statements = trees.getTrees();
        TreeSet<Integer> doomed = new TreeSet<>(Collections.reverseOrder());
        doomed.addAll(positions);

        for (int position : doomed) {
            if (position < 1 || position > statements.size()) {
                throw new IllegalArgumentException(
                        "No tree number " + position + " (block has " + statements.size() + " trees)");
            }
        }
        for (int position : doomed) {
            statements.remove(position - 1);
        }
        log.debug("Deleted {} tree(s), {} remain", doomed.size(), statements.size());
    }

    /**
     * Keep every {@code every}-th tree, starting with the first.
     */
    public static void resample(TreesHandler trees, int every) {
        if (every < 1) {
            throw new IllegalArgumentException("Resample interval must be at least 1, got " + every);
        }
        List<String> statements = trees.getTrees();
        List<String> kept = new ArrayList<>();
        for (int i = 0; i < statements.size(); i += every) {
            kept.add(statements.get(i));
        }
        statements.clear();
        statements.addAll(kept);
        log.debug("Resampled every {} tree(s), {} remain", every, kept.size());
    }

    /**
     * Keep {@code sampleSize} randomly chosen trees, in their original order.
     */
    public static void randomSample(TreesHandler trees, int sampleSize, Random random) {
        List<String> statements = trees.getTrees();
        if (sampleSize < 1 || sampleSize > statements.size()) {
            throw new IllegalArgumentException("Sample size " + sampleSize
                    + " must be between 1 and the number of trees (" + statements.size() + ")");
        }

        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < statements.size(); i++) {
            indices.add(i);
        }
        Collections.shuffle(indices, random);

        List<String> kept = new ArrayList<>();
        for (int index : new TreeSet<>(indices.subList(0, sampleSize))) {
            kept.add(statements.get(index));
        }
        statements.clear();
        statements.addAll(kept);
    }

    public static void removeComments(TreesHandler trees) {
        trees.removeComments();
    }

    public static void detranslate(TreesHandler trees) {
        trees.detranslate();
    }
}
