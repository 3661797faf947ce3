package com.nlbash.command;

import com.nlbash.ast.NodeKinds;
import com.nlbash.ast.SyntaxNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Renders the trees of {@link ShellCommandParser} back into command tokens.
 *
 * <p>With strict constraints a node in a position the parser never produces is an error; with
 * loose constraints, as needed for trees decoded from model output, it is rendered by its value.
 */
public class TokenRenderer implements CommandRenderer {
    private static final Comparator<SyntaxNode> BY_VALUE =
            Comparator.comparing(node -> node.value() == null ? "" : node.value());

    @Override
    public List<String> render(SyntaxNode node, RenderOptions options) {
        MutableList<String> tokens = Lists.mutable.empty();
        render(node, null, options, tokens);
        return tokens;
    }

    private void render(SyntaxNode node, SyntaxNode parent, RenderOptions options, MutableList<String> tokens) {
        String kind = node.kind();
        if (kind == null) {
            violation(node, parent, options, "node without kind");
            return;
        }

        switch (kind) {
            case NodeKinds.ROOT -> renderChildren(node, options, tokens);

            case NodeKinds.PIPELINE -> {
                boolean first = true;
                for (SyntaxNode stage : node.children()) {
                    if (!first) {
                        tokens.add("|");
                    }
                    first = false;
                    render(stage, node, options, tokens);
                }
            }

            case NodeKinds.UTILITY -> {
                tokens.add(node.value());
                MutableList<SyntaxNode> children = node.children().toList();
                if (options.ignoreFlagOrder()) {
                    children = sortFlags(children);
                }
                for (SyntaxNode child : children) {
                    render(child, node, options, tokens);
                }
            }

            case NodeKinds.FLAG -> {
                if (parent == null || !parent.isKind(NodeKinds.UTILITY)) {
                    violation(node, parent, options, "flag outside a utility");
                }
                renderFlag(node, options, tokens);
            }

            case NodeKinds.ARGUMENT -> {
                if (parent == null || !(parent.isKind(NodeKinds.UTILITY) || parent.isKind(NodeKinds.FLAG))) {
                    violation(node, parent, options, "argument outside a utility");
                }
                tokens.add(argumentText(node, options));
            }

            case NodeKinds.OPERATOR -> tokens.add(node.value());

            default -> {
                violation(node, parent, options, "unknown node kind '" + kind + "'");
                if (node.value() != null && !node.value().isEmpty()) {
                    tokens.add(node.value());
                }
                renderChildren(node, options, tokens);
            }
        }
    }

    private void renderChildren(SyntaxNode node, RenderOptions options, MutableList<String> tokens) {
        for (SyntaxNode child : node.children()) {
            render(child, node, options, tokens);
        }
    }

    /**
     * {@code --name=value} flags carry their value as a single argument child.
     */
    private void renderFlag(SyntaxNode flag, RenderOptions options, MutableList<String> tokens) {
        if (flag.children().isEmpty()) {
            tokens.add(flag.value());
            return;
        }
        boolean first = true;
        for (SyntaxNode child : flag.children()) {
            if (!child.isKind(NodeKinds.ARGUMENT)) {
                violation(child, flag, options, "flag value is not an argument");
                render(child, flag, options, tokens);
                continue;
            }
            if (first) {
                tokens.add(flag.value() + "=" + argumentText(child, options));
                first = false;
            } else {
                tokens.add(argumentText(child, options));
            }
        }
        if (first) {
            tokens.add(flag.value());
        }
    }

    private static String argumentText(SyntaxNode argument, RenderOptions options) {
        return options.argTypeOnly() ? argument.argType() : argument.value();
    }

    /**
     * Puts the flags in alphabetical order within the positions flags already occupy.
     */
    private static MutableList<SyntaxNode> sortFlags(MutableList<SyntaxNode> children) {
        MutableList<SyntaxNode> flags = children.select(child -> child.isKind(NodeKinds.FLAG));
        if (flags.size() < 2) {
            return children;
        }
        Iterator<SyntaxNode> sorted = flags.sortThis(BY_VALUE).iterator();
        return children.collect(child -> child.isKind(NodeKinds.FLAG) ? sorted.next() : child);
    }

    private static void violation(SyntaxNode node, SyntaxNode parent, RenderOptions options, String problem) {
        if (!options.looseConstraints()) {
            String where = parent == null ? "top level" : parent.symbol();
            throw new IllegalArgumentException("Cannot render " + node.symbol() + " at " + where + ": " + problem);
        }
    }
}
