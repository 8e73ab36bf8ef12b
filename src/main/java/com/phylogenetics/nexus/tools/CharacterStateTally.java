package com.phylogenetics.nexus.tools;

import java.util.Map;

import lombok.Value;

/**
 * Number of taxa holding each state at one site.
 */
@Value
public class CharacterStateTally {
    /** 0-based site index. */
    int site;
    Map<String, Integer> counts;
}
