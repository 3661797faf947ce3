package com.nlbash.output;

import com.nlbash.ast.SyntaxNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Renders a syntax tree as an indented trace, one {@code KIND(value)} line per node.
 */
public class PrettyPrinter {
    private static final String INDENT = "    ";

    public String print(SyntaxNode node) {
        return print(node, 0);
    }

    public String print(SyntaxNode node, int depth) {
        StringBuilder sb = new StringBuilder(256);
        try {
            print(node, depth, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /**
     * Appends the trace of {@code node} to {@code out}, starting at {@code depth}.
     */
    public void print(SyntaxNode node, int depth, Appendable out) throws IOException {
        String indentStr = INDENT.repeat(depth);

        // Nodes missing a kind or value still get their line, without a label or subtree
        if (node == null || node.kind() == null || node.value() == null) {
            out.append(indentStr).append('\n');
            return;
        }

        out.append(indentStr)
           .append(node.kind().toUpperCase(Locale.ROOT))
           .append('(')
           .append(node.value())
           .append(")\n");
        for (SyntaxNode child : node.children()) {
            print(child, depth + 1, out);
        }
    }
}
