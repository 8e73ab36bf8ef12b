package com.phylogenetics.nexus.tools;

import lombok.Value;

/**
 * How many of a taxon's sites hold one of the counted states.
 */
@Value
public class SiteValueCount {
    String taxon;
    int count;
    int total;

    public double getPercent() {
        return total == 0 ? 0.0 : (count * 100.0) / total;
    }
}
