package com.nlbash.ast;

import com.nlbash.command.ParseOptions;
import com.nlbash.command.ShellCommandParser;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TreeLinearizerTest {
    private static final String END = TreeLinearizer.NO_EXPAND;

    private final TreeLinearizer linearizer = new TreeLinearizer();

    private static SyntaxNode lsTree() {
        return SyntaxNode.root()
                .with(SyntaxNode.of(NodeKinds.UTILITY, "ls")
                        .with(SyntaxNode.of(NodeKinds.FLAG, "-l"))
                        .with(SyntaxNode.argument("/tmp", "File")));
    }

    @Test
    public void testLinearizeSingleNode() {
        assertEquals(List.of("ROOT", END), linearizer.linearize(SyntaxNode.root()));
    }

    @Test
    public void testLinearizeIsPreOrderWithTerminators() {
        List<String> sequence = linearizer.linearize(lsTree());
        assertEquals(List.of("ROOT", "UTILITY_ls", "FLAG_-l", END, "ARGUMENT_File_/tmp", END, END, END), sequence);
    }

    @Test
    public void testTerminatorCountEqualsNodeCount() {
        SyntaxNode tree = lsTree();
        List<String> sequence = linearizer.linearize(tree);
        long terminators = sequence.stream().filter(END::equals).count();
        assertEquals(tree.size(), terminators);
        assertEquals(tree.size() * 2, sequence.size());
    }

    @Test
    public void testRoundTripSingleNode() {
        SyntaxNode root = SyntaxNode.root();
        assertEquals(root, linearizer.delinearize(linearizer.linearize(root)).orElseThrow());
    }

    @Test
    public void testRoundTripHandBuiltTree() {
        SyntaxNode tree = lsTree();
        assertEquals(tree, linearizer.delinearize(linearizer.linearize(tree)).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "ls -l -a /tmp",
        "cd dir1",
        "cat file.txt | grep -i foo | wc -l",
        "mkdir -p a/b && cd a/b",
        "sort --key=2 data.csv ; echo done",
        "echo 'hello world'",
        "find . -name \"*.txt\" -exec rm {} \\;",
        "make 2>&1 | tee build.log &"
    })
    public void testRoundTripParsedCommands(String command) {
        ShellCommandParser parser = new ShellCommandParser();
        for (ParseOptions options : List.of(ParseOptions.defaults(), ParseOptions.verbatim())) {
            SyntaxNode tree = parser.parse(command, options);
            SyntaxNode restored = linearizer.delinearize(linearizer.linearize(tree)).orElseThrow();
            assertEquals(tree, restored, command);
            assertEquals(linearizer.linearize(tree), linearizer.linearize(restored));
        }
    }

    @Test
    public void testTruncatedSequenceGivesShallowerTree() {
        List<String> sequence = linearizer.linearize(lsTree());

        SyntaxNode partial = linearizer.delinearize(sequence.subList(0, 3)).orElseThrow();

        assertEquals("root", partial.kind());
        assertEquals(1, partial.children().size());
        SyntaxNode utility = partial.children().getFirst();
        assertEquals("ls", utility.value());
        assertEquals(1, utility.children().size());
        assertEquals("-l", utility.children().getFirst().value());
    }

    @Test
    public void testEveryPrefixDelinearizes() {
        SyntaxNode tree = new ShellCommandParser().parse("cat a.txt | sort -r | uniq -c && echo ok", ParseOptions.defaults());
        List<String> sequence = linearizer.linearize(tree);

        for (int n = 1; n <= sequence.size(); n++) {
            Optional<SyntaxNode> partial = linearizer.delinearize(sequence.subList(0, n));
            assertTrue(partial.isPresent());
            assertTrue(partial.get().size() <= tree.size());
        }
    }

    @Test
    public void testPaddingActsAsTerminator() {
        SyntaxNode tree = lsTree();
        MutableList<String> sequence = Lists.mutable.withAll(linearizer.linearize(tree));
        sequence.add(TreeLinearizer.PAD);
        assertEquals(tree, linearizer.delinearize(sequence).orElseThrow());

        SyntaxNode padded = linearizer.delinearize(
                List.of("ROOT", "UTILITY_ls", TreeLinearizer.PAD, TreeLinearizer.PAD)).orElseThrow();
        assertEquals(SyntaxNode.root().with(SyntaxNode.of(NodeKinds.UTILITY, "ls")), padded);
    }

    @Test
    public void testEmptyOrTerminatorFirstSequence() {
        assertTrue(linearizer.delinearize(List.of()).isEmpty());
        assertTrue(linearizer.delinearize(List.of(END, "ROOT")).isEmpty());
        assertTrue(linearizer.delinearize(List.of(TreeLinearizer.PAD)).isEmpty());
    }

    @Test
    public void testSymbolsAfterRootAreIgnored() {
        SyntaxNode tree = lsTree();
        MutableList<String> sequence = Lists.mutable.withAll(linearizer.linearize(tree));
        sequence.with("UTILITY_rm").with(END);
        assertEquals(tree, linearizer.delinearize(sequence).orElseThrow());
    }

    @Test
    public void testUnknownSymbolsBecomeNodes() {
        SyntaxNode tree = linearizer.delinearize(List.of("ROOT", "FOO_bar", END, END)).orElseThrow();
        assertEquals(1, tree.children().size());
        assertEquals("foo", tree.children().getFirst().kind());
        assertEquals("bar", tree.children().getFirst().value());
    }

    @Test
    public void testIsTerminator() {
        assertTrue(TreeLinearizer.isTerminator(END));
        assertTrue(TreeLinearizer.isTerminator(TreeLinearizer.PAD));
        assertFalse(TreeLinearizer.isTerminator("ROOT"));
    }
}
