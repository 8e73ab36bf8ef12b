package com.phylogenetics.nexus.writer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.phylogenetics.nexus.handler.BlockHandler;
import com.phylogenetics.nexus.handler.DataHandler;
import com.phylogenetics.nexus.handler.GenericHandler;
import com.phylogenetics.nexus.handler.TaxaHandler;
import com.phylogenetics.nexus.handler.TreesHandler;
import com.phylogenetics.nexus.model.NexusDocument;
import com.phylogenetics.nexus.parser.NexusReader;

import static com.phylogenetics.nexus.TestFixtures.fixture;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for NexusWriter, including write-then-read round trips of the fixture files.
 */
class NexusWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testHeaderPrecedesBlocks() {
        NexusDocument doc = new NexusReader().parse("""
                #NEXUS
                begin assumptions;
                    options deftype=unord;
                end;
                """);

        assertThat(new NexusWriter().write(doc)).isEqualTo("""
                #NEXUS

                begin assumptions;
                    options deftype=unord;
                end;
                """);
    }

    @Test
    void testWriteToFileCreatesParentDirectories() throws IOException {
        NexusDocument doc = new NexusReader().read(fixture("nexus/example.nex"));
        Path target = tempDir.resolve("out/nested/example.nex");

        doc.writeToFile(target);

        assertThat(Files.readString(target)).isEqualTo(doc.write());
        assertThat(new NexusReader().read(target).getData().getSequences())
                .isEqualTo(doc.getData().getSequences());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "nexus/example.nex",
            "nexus/example2.nex",
            "nexus/example3.nex",
            "nexus/example-characters.nex",
            "nexus/example.trees",
            "nexus/example-translated.trees",
            "nexus/example-beast.trees",
            "regression/ape_random.trees",
            "regression/mesquite_taxa_block.nex",
            "regression/mesquite_formatted_branches.trees",
            "regression/taxlabels.nex"
    })
    void testRoundTrip(String resource) throws IOException {
        NexusDocument original = new NexusReader().read(fixture(resource));
        NexusDocument reread = new NexusReader().parse(original.write());

        assertThat(reread.getBlocks().keySet()).containsExactlyElementsOf(original.getBlocks().keySet());
        for (String name : original.getBlocks().keySet()) {
            assertSameContent(original.getBlocks().get(name), reread.getBlocks().get(name));
        }
    }

    private static void assertSameContent(BlockHandler expected, BlockHandler actual) {
        assertThat(actual).isInstanceOf(expected.getClass());
        if (expected instanceof DataHandler data) {
            DataHandler other = (DataHandler) actual;
            assertThat(other.getNtaxa()).isEqualTo(data.getNtaxa());
            assertThat(other.getNchar()).isEqualTo(data.getNchar());
            assertThat(other.getTaxa()).isEqualTo(data.getTaxa());
            assertThat(other.getSequences()).isEqualTo(data.getSequences());
            assertThat(other.getFormat().asMap()).isEqualTo(data.getFormat().asMap());
            assertThat(other.getAttributes()).isEqualTo(data.getAttributes());
        } else if (expected instanceof TreesHandler trees) {
            TreesHandler other = (TreesHandler) actual;
            assertThat(other.getTrees()).isEqualTo(trees.getTrees());
            assertThat(other.getTranslators()).isEqualTo(trees.getTranslators());
            assertThat(other.isWasTranslated()).isEqualTo(trees.isWasTranslated());
            assertThat(other.getAttributes()).isEqualTo(trees.getAttributes());
        } else if (expected instanceof TaxaHandler taxa) {
            TaxaHandler other = (TaxaHandler) actual;
            assertThat(other.getTaxa()).isEqualTo(taxa.getTaxa());
            assertThat(other.getAttributes()).isEqualTo(taxa.getAttributes());
        } else if (expected instanceof GenericHandler generic) {
            assertThat(((GenericHandler) actual).getStorage()).isEqualTo(generic.getStorage());
        }
    }
}
