package com.nlbash.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxNodeTest {

    @Test
    public void testSymbols() {
        assertEquals("ROOT", SyntaxNode.root().symbol());
        assertEquals("PIPELINE", SyntaxNode.of(NodeKinds.PIPELINE, "").symbol());
        assertEquals("UTILITY_ls", SyntaxNode.of(NodeKinds.UTILITY, "ls").symbol());
        assertEquals("FLAG_-l", SyntaxNode.of(NodeKinds.FLAG, "-l").symbol());
        assertEquals("OPERATOR_&&", SyntaxNode.of(NodeKinds.OPERATOR, "&&").symbol());
        assertEquals("ARGUMENT_Unknown_dir_NUM", SyntaxNode.argument("dir_NUM", null).symbol());
        assertEquals("ARGUMENT_File_/tmp", SyntaxNode.argument("/tmp", "File").symbol());
    }

    @Test
    public void testFromSymbolInvertsSymbol() {
        SyntaxNode[] nodes = {
            SyntaxNode.root(),
            SyntaxNode.of(NodeKinds.UTILITY, "md5_sum"),
            SyntaxNode.of(NodeKinds.FLAG, "--max-depth"),
            SyntaxNode.argument("_NUM", "Number"),
            SyntaxNode.argument("", "Pattern"),
        };
        for (SyntaxNode node : nodes) {
            assertEquals(node, SyntaxNode.fromSymbol(node.symbol()));
        }
    }

    @Test
    public void testFromSymbolKeepsUnknownKinds() {
        SyntaxNode node = SyntaxNode.fromSymbol("REDIRECT_>");
        assertEquals("redirect", node.kind());
        assertEquals(">", node.value());
    }

    @Test
    public void testWithDoesNotTouchOriginal() {
        SyntaxNode utility = SyntaxNode.of(NodeKinds.UTILITY, "ls");
        SyntaxNode withFlag = utility.with(SyntaxNode.of(NodeKinds.FLAG, "-l"));

        assertTrue(utility.children().isEmpty());
        assertEquals(1, withFlag.children().size());
        assertEquals(2, withFlag.size());
    }

    @Test
    public void testSize() {
        SyntaxNode tree = SyntaxNode.root()
                .with(SyntaxNode.of(NodeKinds.UTILITY, "ls")
                        .with(SyntaxNode.of(NodeKinds.FLAG, "-a"))
                        .with(SyntaxNode.argument("/tmp", "File")));
        assertEquals(4, tree.size());
    }
}
