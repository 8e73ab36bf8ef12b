package com.phylogenetics.nexus.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.phylogenetics.nexus.exception.DuplicateBlockException;
import com.phylogenetics.nexus.exception.UnterminatedBlockException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NexusBlockSplitter.
 */
class NexusBlockSplitterTest {

    @Test
    void testSplitsBlocksInOrder() {
        String source = """
                #NEXUS

                [written by hand]
                begin taxa;
                    dimensions ntax=2;
                    taxlabels A B;
                end;

                BEGIN Trees;
                    tree t1 = (A,B);
                END;
                """;

        List<RawBlock> blocks = new NexusBlockSplitter(source).split();

        assertThat(blocks).extracting(RawBlock::getName).containsExactly("taxa", "Trees");
        assertThat(blocks.get(0).getLines()).containsExactly("dimensions ntax=2;", "taxlabels A B;");
        assertThat(blocks.get(1).getLines()).containsExactly("tree t1 = (A,B);");
        assertThat(blocks.get(0).getStartLine()).isEqualTo(4);
    }

    @Test
    void testEndblockClosesBlock() {
        String source = """
                begin assumptions;
                    usertype myType = 2;
                endblock;
                """;

        List<RawBlock> blocks = new NexusBlockSplitter(source).split();

        assertThat(blocks).hasSize(1);
        assertThat(blocks.get(0).getLines()).containsExactly("usertype myType = 2;");
    }

    @Test
    void testInlineCommentsAreKept() {
        String source = """
                begin taxa;
                    taxlabels
                        [1] A
                    ;
                end;
                """;

        RawBlock block = new NexusBlockSplitter(source).split().get(0);

        assertThat(block.getLines()).containsExactly("taxlabels", "[1] A", ";");
    }

    @Test
    void testDuplicateBlockIsRejected() {
        String source = """
                begin data;
                end;
                begin DATA;
                end;
                """;

        DuplicateBlockException e = catchThrowableOfType(
                () -> new NexusBlockSplitter(source).split(), DuplicateBlockException.class);

        assertThat(e).isNotNull();
        assertThat(e.getBlockName()).isEqualTo("data");
        assertThat(e).hasMessageContaining("line 3");
    }

    @Test
    void testBlockLeftOpenAtEndOfInputIsRejected() {
        String source = """
                begin data;
                    dimensions ntax=1 nchar=1;
                """;

        assertThatThrownBy(() -> new NexusBlockSplitter(source).split())
                .isInstanceOf(UnterminatedBlockException.class)
                .hasMessageContaining("data");
    }

    @Test
    void testBlockLeftOpenBeforeNextBeginIsRejected() {
        String source = """
                begin taxa;
                    taxlabels A B;
                begin trees;
                end;
                """;

        assertThatThrownBy(() -> new NexusBlockSplitter(source).split())
                .isInstanceOf(UnterminatedBlockException.class)
                .hasMessageContaining("taxa");
    }

    @Test
    void testTrailingTerminatorClosesBlockAtEndOfInput() {
        String source = """
                Begin something;
                    Matrix
                    Harry 1
                    ;""";

        List<RawBlock> blocks = new NexusBlockSplitter(source).split();

        assertThat(blocks).hasSize(1);
        assertThat(blocks.get(0).getLines()).containsExactly("Matrix", "Harry 1", ";");
    }

    @Test
    void testTrailingTerminatorClosesBlockBeforeNextBegin() {
        String source = """
                begin something;
                    foo
                    ;
                begin other;
                end;
                """;

        assertThat(new NexusBlockSplitter(source).split())
                .extracting(RawBlock::getName)
                .containsExactly("something", "other");
    }

    @Test
    void testStatementsAfterBeginBecomeBlockLines() {
        String source = """
                Begin data; Dimensions ntax=1 nchar=1; Format symbols="0;1" [a;b]; Matrix
                A 0
                ; End;
                """;

        RawBlock block = new NexusBlockSplitter(source).split().get(0);

        assertThat(block.getName()).isEqualTo("data");
        assertThat(block.getLines()).containsExactly(
                "Dimensions ntax=1 nchar=1;",
                "Format symbols=\"0;1\" [a;b];",
                "Matrix",
                "A 0",
                ";");
    }

    @Test
    void testEndAfterOtherStatementsClosesBlock() {
        String source = """
                begin taxa; dimensions ntax=1; taxlabels A; end;
                begin trees;
                    tree t1 = (A); END; [done]
                """;

        List<RawBlock> blocks = new NexusBlockSplitter(source).split();

        assertThat(blocks).extracting(RawBlock::getName).containsExactly("taxa", "trees");
        assertThat(blocks.get(0).getLines()).containsExactly("dimensions ntax=1;", "taxlabels A;");
        assertThat(blocks.get(1).getLines()).containsExactly("tree t1 = (A);");
    }

    @Test
    void testWordEndingInEndDoesNotCloseBlock() {
        String source = """
                begin notes;
                    text legend;
                end;
                """;

        RawBlock block = new NexusBlockSplitter(source).split().get(0);

        assertThat(block.getLines()).containsExactly("text legend;");
    }

    @Test
    void testEmptyInput() {
        assertThat(new NexusBlockSplitter("").split()).isEmpty();
        assertThat(new NexusBlockSplitter("#NEXUS\n").split()).isEmpty();
    }
}
