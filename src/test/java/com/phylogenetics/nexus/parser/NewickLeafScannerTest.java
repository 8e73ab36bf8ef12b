package com.phylogenetics.nexus.parser;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NewickLeafScanner.
 */
class NewickLeafScannerTest {

    @Test
    void testLeafLabels() {
        NewickLeafScanner scanner = new NewickLeafScanner("tree t1 = ((1:0.1,2:0.2)3:0.5,40);");

        assertThat(scanner.leafLabels()).containsExactly("1", "2", "40");
    }

    @Test
    void testRewriteLeavesOnlyTouchesLeafTokens() {
        Map<String, String> names = Map.of("1", "one", "4", "four");
        String rewritten = new NewickLeafScanner("tree t4 = ((1:4,40:1)4:1,4);")
                .rewriteLeaves(token -> names.getOrDefault(token, token));

        assertThat(rewritten).isEqualTo("tree t4 = ((one:4,40:1)4:1,four);");
    }

    @Test
    void testCommentsArePassedThrough() {
        String rewritten = new NewickLeafScanner("tree s [&lnP=-1] = [&R] (1[&rate=1.0]:2,2);")
                .rewriteLeaves(token -> "x" + token);

        assertThat(rewritten).isEqualTo("tree s [&lnP=-1] = [&R] (x1[&rate=1.0]:2,x2);");
    }

    @Test
    void testQuotedLabelsAreSingleTokens() {
        NewickLeafScanner scanner = new NewickLeafScanner("('Homo sapiens','O''Brien',C);");

        assertThat(scanner.leafLabels()).containsExactly("'Homo sapiens'", "'O''Brien'", "C");
    }

    @Test
    void testBareNewickString() {
        assertThat(new NewickLeafScanner("(A,(B,C));").leafLabels()).containsExactly("A", "B", "C");
    }
}
