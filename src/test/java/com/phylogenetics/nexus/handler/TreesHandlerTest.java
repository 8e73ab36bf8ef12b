package com.phylogenetics.nexus.handler;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.phylogenetics.nexus.parser.NexusReader;

import static com.phylogenetics.nexus.TestFixtures.fixture;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TreesHandler.
 */
class TreesHandlerTest {

    private static TreesHandler parse(String... lines) {
        TreesHandler handler = new TreesHandler();
        handler.parse(List.of(lines));
        return handler;
    }

    private static TreesHandler read(String resource) throws IOException {
        return new NexusReader().read(fixture(resource)).getTrees();
    }

    @Test
    void testDetranslateSimpleTree() {
        TreesHandler trees = parse("translate 1 A, 2 B, 3 C;", "tree t1 = (1,2,3);");

        assertThat(trees.isWasTranslated()).isTrue();
        assertThat(trees.getTranslators()).containsExactly(entry("1", "A"), entry("2", "B"), entry("3", "C"));

        trees.detranslate();

        assertThat(trees.get(0)).isEqualTo("tree t1 = (A,B,C);");
        assertThat(trees.isBeenDetranslated()).isTrue();
    }

    @Test
    void testDetranslateIsIdempotent() {
        TreesHandler trees = parse("translate 1 2, 2 3, 3 1;", "tree t1 = (1,2,3);");

        trees.detranslate();
        trees.detranslate();

        assertThat(trees.get(0)).isEqualTo("tree t1 = (2,3,1);");
    }

    @Test
    void testDetranslateWithoutTableDoesNothing() {
        TreesHandler trees = parse("tree t1 = (A,B);");

        trees.detranslate();

        assertThat(trees.get(0)).isEqualTo("tree t1 = (A,B);");
        assertThat(trees.isWasTranslated()).isFalse();
        assertThat(trees.isBeenDetranslated()).isFalse();
    }

    @Test
    void testRetranslateRestoresLabels() {
        TreesHandler trees = parse("translate 1 A, 2 B;", "tree t1 = (1:0.5,2:1);");

        trees.detranslate();
        assertThat(trees.get(0)).isEqualTo("tree t1 = (A:0.5,B:1);");

        trees.retranslate();
        assertThat(trees.get(0)).isEqualTo("tree t1 = (1:0.5,2:1);");
        assertThat(trees.isBeenDetranslated()).isFalse();
    }

    @Test
    void testTranslateTableSpanningLines() {
        TreesHandler trees = parse(
                "translate",
                "1 'Homo sapiens',",
                "2 Pan,",
                ";",
                "tree t1 = (1,",
                "2);");

        assertThat(trees.getTranslators()).containsExactly(entry("1", "Homo sapiens"), entry("2", "Pan"));
        assertThat(trees.getTrees()).containsExactly("tree t1 = (1, 2);");

        trees.detranslate();
        assertThat(trees.get(0)).isEqualTo("tree t1 = ('Homo sapiens', Pan);");
    }

    @Test
    void testTreeStatementBrokenBetweenWords() {
        TreesHandler trees = parse("translate 1 A, 2 B;", "tree", "t1 =", "(1,2);");

        assertThat(trees.getTrees()).containsExactly("tree t1 = (1,2);");

        trees.detranslate();
        assertThat(trees.get(0)).isEqualTo("tree t1 = (A,B);");
    }

    @Test
    void testReadExampleTrees() throws IOException {
        TreesHandler trees = read("nexus/example.trees");

        assertThat(trees.getNtrees()).isEqualTo(3);
        assertThat(trees.get(0)).startsWith("tree tree.0.1065.603220");
        assertThat(trees.get(1)).startsWith("tree tree.10000.874.808756");
        assertThat(trees.get(2)).startsWith("tree tree.20000.883.396049");
        assertThat(trees.isWasTranslated()).isFalse();
        assertThat(trees.getTaxa()).hasSize(13).contains("Chris", "David", "Timothy");
    }

    @Test
    void testDetranslatedTreeMatchesUntranslatedFile() throws IOException {
        TreesHandler translated = read("nexus/example-translated.trees");
        TreesHandler plain = read("nexus/example.trees");

        assertThat(translated.getTranslators()).hasSize(13);
        translated.detranslate();

        assertThat(translated.getTrees()).isEqualTo(plain.getTrees());
    }

    @Test
    void testDetranslateWithDashInTaxonName() throws IOException {
        TreesHandler trees = read("regression/detranslate-with-dash.trees");

        assertThat(trees.getNtrees()).isEqualTo(1);
        assertThat(trees.getTranslators()).containsEntry("4", "four-1").containsEntry("5", "four_2");

        trees.detranslate();
        assertThat(trees.get(0)).contains("(one,two,three,four-1,four_2)");
    }

    @Test
    void testDetranslateWithIntegerBranchLengths() throws IOException {
        TreesHandler trees = read("regression/branchlengths-in-integers.trees");

        trees.detranslate();

        assertThat(trees.get(0)).contains("(one:0.1,two:0.2,three:1,four:3,five:0.3)");
    }

    @Test
    void testBadCharactersInTaxonNames() throws IOException {
        TreesHandler trees = read("regression/bad_chars_in_taxaname.trees");

        assertThat(trees.getTranslators()).hasSize(5).containsEntry("5", "PALAUNGWA_De.Ang");

        trees.detranslate();
        assertThat(trees.get(0)).contains("(MANGIC_Bugan,MANGIC_Paliu,MANGIC_Mang,PALAUNGWA_Danaw,PAL");
    }

    @Test
    void testApeRandomTrees() throws IOException {
        TreesHandler trees = read("regression/ape_random.trees");

        assertThat(trees.getNtrees()).isEqualTo(2);
        assertThat(trees.getTranslators()).hasSize(10).containsEntry("10", "t6");
    }

    @Test
    void testMesquiteTreeBlock() throws IOException {
        TreesHandler trees = read("regression/mesquite_formatted_branches.trees");

        assertThat(trees.getAttributes()).containsExactly(
                "Title 'Trees from \"temp.trees\"';",
                "LINK Taxa = Untitled_Block_of_Taxa;");
        assertThat(trees.getNtrees()).isEqualTo(1);
        assertThat(trees.isWasTranslated()).isTrue();
        assertThat(trees.getTranslators()).containsExactly(entry("1", "A"), entry("2", "B"), entry("3", "C"));
        assertThat(trees.getTaxa()).containsExactly("A", "B", "C");

        String written = trees.write();
        assertThat(written).contains("Title 'Trees from \"temp.trees\"';");
        assertThat(written).contains("LINK Taxa = Untitled_Block_of_Taxa;");
    }

    @Test
    void testRemoveCommentsFromBeastTrees() throws IOException {
        TreesHandler trees = read("nexus/example-beast.trees");

        assertThat(trees.get(0)).contains("[&lnP=-15795.47019648783]");

        trees.removeComments();

        assertThat(trees.get(0)).doesNotContain("[&lnP=-15795.47019648783]").doesNotContain("[&R]");
        assertThat(trees.get(0)).startsWith("tree STATE_0");
    }

    @Test
    void testWriteTranslateTable() {
        TreesHandler trees = parse("translate 1 A, 2 'B c';", "tree t1 = (1,2);");

        String written = trees.write();

        assertThat(written).isEqualTo("""
                begin trees;
                    translate
                        1 A,
                        2 'B c';
                    tree t1 = (1,2);
                end;
                """);
    }

    @Test
    void testWriteAfterDetranslateOmitsTable() {
        TreesHandler trees = parse("translate 1 A, 2 B;", "tree t1 = (1,2);");

        trees.detranslate();

        assertThat(trees.write()).doesNotContain("translate").contains("tree t1 = (A,B);");
    }

    @Test
    void testRenameTaxonInTranslatedBlock() {
        TreesHandler trees = parse("translate 1 A, 2 B;", "tree t1 = (1,2);");

        trees.renameTaxon("A", "Alpha");

        assertThat(trees.getTranslators()).containsEntry("1", "Alpha");
        assertThat(trees.get(0)).isEqualTo("tree t1 = (1,2);");
    }

    @Test
    void testRenameTaxonInUntranslatedBlock() {
        TreesHandler trees = parse("tree t1 = ((A,AB),B);");

        trees.renameTaxon("A", "Alpha");

        assertThat(trees.get(0)).isEqualTo("tree t1 = ((Alpha,AB),B);");
    }

    @Test
    void testToString() {
        assertThat(parse("tree t1 = (A,B);", "tree t2 = (B,A);")).hasToString("<NexusTreeBlock: 2 trees>");
    }
}
