package com.phylogenetics.nexus.tools;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phylogenetics.nexus.exception.NexusException;
import com.phylogenetics.nexus.handler.DataHandler;
import com.phylogenetics.nexus.model.NexusDocument;

/**
 * Site-level queries over a character matrix, and site removal.
 *
 * Site indices are 0-based. Gap and missing states are the declared gap/missing
 * characters plus '-' and '?'.
 */
public class CharacterAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(CharacterAnalyzer.class);

    public static final List<String> DEFAULT_COUNTED_STATES = List.of("-", "?");

    private static final String ABSENT = "0";

    private CharacterAnalyzer() {
        // Utility class
    }

    /**
     * Per taxon, the number of sites whose state is one of {@code states}.
     */
    public static List<SiteValueCount> countSiteValues(DataHandler data, Collection<String> states) {
        Set<String> counted = new HashSet<>(states);
        List<SiteValueCount> counts = new ArrayList<>();
        for (String taxon : data.getTaxa()) {
            int count = (int) data.getSites(taxon).stream().filter(counted::contains).count();
            counts.add(new SiteValueCount(taxon, count, data.getNchar()));
        }
        return counts;
    }

    /**
     * Sites where every taxon with data has the same state.
     */
    public static List<Integer> findConstantSites(DataHandler data) {
        List<Integer> constant = new ArrayList<>();
        Set<String> missing = missingStates(data);
        for (Map.Entry<Integer, Map<String, String>> column : data.getCharacters().entrySet()) {
            if (observedStates(column.getValue(), missing).size() == 1) {
                constant.add(column.getKey());
            }
        }
        return constant;
    }

    /**
     * Sites with two observed states where a present (non-'0') state is held by a
     * single taxon.
     */
    public static List<Integer> findUniqueSites(DataHandler data) {
        List<Integer> unique = new ArrayList<>();
        Set<String> missing = missingStates(data);
        for (Map.Entry<Integer, Map<String, String>> column : data.getCharacters().entrySet()) {
            Map<String, Integer> members = observedStates(column.getValue(), missing);
            if (members.size() != 2) {
                continue;
            }
            boolean singleton = members.entrySet().stream()
                    .anyMatch(e -> !ABSENT.equals(e.getKey()) && e.getValue() == 1);
            if (singleton) {
                unique.add(column.getKey());
            }
        }
        return unique;
    }

    /**
     * Sites holding nothing but '0', gap or missing states.
     */
    public static List<Integer> findZeroSites(DataHandler data) {
        List<Integer> zeros = new ArrayList<>();
        Set<String> missing = missingStates(data);
        for (Map.Entry<Integer, Map<String, String>> column : data.getCharacters().entrySet()) {
            Set<String> observed = observedStates(column.getValue(), missing).keySet();
            if (observed.isEmpty() || (observed.size() == 1 && observed.contains(ABSENT))) {
                zeros.add(column.getKey());
            }
        }
        return zeros;
    }

    /**
     * State counts for every site, gap and missing included.
     */
    public static List<CharacterStateTally> tallyStates(DataHandler data) {
        List<CharacterStateTally> tallies = new ArrayList<>();
        for (Map.Entry<Integer, Map<String, String>> column : data.getCharacters().entrySet()) {
            Map<String, Integer> counts = new TreeMap<>();
            for (String state : column.getValue().values()) {
                counts.merge(state, 1, Integer::sum);
            }
            tallies.add(new CharacterStateTally(column.getKey(), counts));
        }
        return tallies;
    }

    /**
     * Remove sites from the document's data block in place.
     */
    public static void removeSites(NexusDocument document, Collection<Integer> sites) {
        DataHandler data = document.getData();
        if (data == null) {
            throw new NexusException("Document has no data or characters block");
        }
        data.removeSites(sites);
        log.info("Removed {} site(s); {} remain", sites.size(), data.getNchar());
    }

    private static Set<String> missingStates(DataHandler data) {
        Set<String> missing = new HashSet<>(DEFAULT_COUNTED_STATES);
        data.getFormat().getGap().ifPresent(missing::add);
        data.getFormat().getMissing().ifPresent(missing::add);
        return missing;
    }

    private static Map<String, Integer> observedStates(Map<String, String> column, Set<String> missing) {
        Map<String, Integer> observed = new LinkedHashMap<>();
        for (String state : column.values()) {
            if (!missing.contains(state)) {
                observed.merge(state, 1, Integer::sum);
            }
        }
        return observed;
    }
}
