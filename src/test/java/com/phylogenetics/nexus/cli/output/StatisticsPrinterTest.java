package com.phylogenetics.nexus.cli.output;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import com.phylogenetics.nexus.tools.CharacterStateTally;
import com.phylogenetics.nexus.tools.SiteValueCount;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StatisticsPrinter.
 */
class StatisticsPrinterTest {

    private final StatisticsPrinter printer = new StatisticsPrinter();

    @Test
    void testSiteValuesAreSortedByTaxon() throws IOException {
        StringWriter out = new StringWriter();

        printer.printSiteValues(out, "example.nex", List.of("-", "?"), List.of(
                new SiteValueCount("Simon", 1, 4),
                new SiteValueCount("Harry", 2, 4)));

        String[] lines = out.toString().split("\n");
        assertThat(lines[0]).isEqualTo("Number of -,? in example.nex");
        assertThat(lines[1]).startsWith("Harry").endsWith(": 2/4 (50.00%)");
        assertThat(lines[2]).startsWith("Simon").endsWith(": 1/4 (25.00%)");
        assertThat(lines[4]).isEqualTo("TOTAL: 3/8 (37.50%)");
    }

    @Test
    void testEmptySiteValues() throws IOException {
        StringWriter out = new StringWriter();

        printer.printSiteValues(out, "empty.nex", List.of("-"), List.of());

        assertThat(out.toString()).contains("TOTAL: 0/0 (0.00%)");
    }

    @Test
    void testCharacterStats() throws IOException {
        StringWriter out = new StringWriter();
        Map<String, Integer> counts = new TreeMap<>(Map.of("0", 3, "1", 1));

        printer.printCharacterStats(out, List.of(new CharacterStateTally(9, counts)));

        assertThat(out.toString()).isEqualTo("   10 0x3 1x1\n");
    }

    @Test
    void testSitesArePrintedOneBased() throws IOException {
        StringWriter out = new StringWriter();

        printer.printSites(out, "Constant Sites", List.of(0, 4, 1999));

        assertThat(out.toString()).isEqualTo("Constant Sites: 1,5,2000\n");
    }
}
