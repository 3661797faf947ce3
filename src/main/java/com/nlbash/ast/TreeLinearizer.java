package com.nlbash.ast;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Optional;

/**
 * Converts syntax trees to flat depth-first symbol sequences and back.
 *
 * <p>Every node contributes its symbol followed, after its whole subtree, by {@link #NO_EXPAND}.
 * A sequence therefore holds exactly as many terminators as node symbols.
 */
public class TreeLinearizer {
    public static final String NO_EXPAND = "<NO_EXPAND>";

    /**
     * Legacy padding symbol. Read as a terminator when delinearizing.
     */
    public static final String PAD = "<PAD>";

    public List<String> linearize(SyntaxNode root) {
        MutableList<String> sequence = Lists.mutable.empty();
        linearize(root, sequence);
        return sequence;
    }

    private void linearize(SyntaxNode node, MutableList<String> sequence) {
        sequence.add(node.symbol());
        for (SyntaxNode child : node.children()) {
            linearize(child, sequence);
        }
        sequence.add(NO_EXPAND);
    }

    /**
     * Rebuilds a tree from a linearized sequence.
     *
     * <p>Never fails on malformed input: a sequence that runs out mid-subtree closes every open
     * node, and symbols left over after the root is closed are ignored.
     *
     * @return the root, or empty when the sequence is empty or starts with a terminator
     */
    public Optional<SyntaxNode> delinearize(List<String> sequence) {
        return Optional.ofNullable(readNode(new Cursor(sequence)));
    }

    public static boolean isTerminator(String symbol) {
        return NO_EXPAND.equals(symbol) || PAD.equals(symbol);
    }

    private SyntaxNode readNode(Cursor cursor) {
        if (!cursor.hasNext()) {
            return null;
        }
        String symbol = cursor.next();
        if (isTerminator(symbol)) {
            return null;
        }
        MutableList<SyntaxNode> children = Lists.mutable.empty();
        while (cursor.hasNext()) {
            SyntaxNode child = readNode(cursor);
            if (child == null) {
                break;
            }
            children.add(child);
        }
        return SyntaxNode.fromSymbol(symbol).withChildren(children.toImmutable());
    }

    private static final class Cursor {
        private final List<String> sequence;
        private int index;

        Cursor(List<String> sequence) {
            this.sequence = sequence;
        }

        boolean hasNext() {
            return index < sequence.size();
        }

        String next() {
            return sequence.get(index++);
        }
    }
}
