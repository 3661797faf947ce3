package com.nlbash.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Locale;

/**
 * A node of a shell command syntax tree.
 *
 * <p>Nodes are immutable. {@code kind} and {@code value} are expected to be non-null for trees
 * built by a parser; foreign or partially built nodes may leave them null and are tolerated by
 * the pretty printer.
 *
 * @param kind     lower-case category tag, see {@link NodeKinds}
 * @param value    node payload, empty for structural nodes such as {@code root}
 * @param argType  type tag of an argument node, empty for every other kind
 * @param children ordered children; the order is the argument/flag position
 */
public record SyntaxNode(String kind, String value, String argType, ImmutableList<SyntaxNode> children) {
    public static final String UNKNOWN_TYPE = "Unknown";

    private static final char SYMBOL_SEPARATOR = '_';

    public SyntaxNode {
        argType = argType == null ? "" : argType;
        children = children == null ? Lists.immutable.empty() : children;
    }

    public static SyntaxNode of(String kind, String value) {
        return new SyntaxNode(kind, value, "", Lists.immutable.empty());
    }

    public static SyntaxNode root() {
        return of(NodeKinds.ROOT, "");
    }

    public static SyntaxNode argument(String value, String argType) {
        String type = argType == null || argType.isEmpty() ? UNKNOWN_TYPE : argType;
        return new SyntaxNode(NodeKinds.ARGUMENT, value, type, Lists.immutable.empty());
    }

    public SyntaxNode with(SyntaxNode child) {
        return new SyntaxNode(kind, value, argType, children.newWith(child));
    }

    public SyntaxNode withChildren(ImmutableList<SyntaxNode> newChildren) {
        return new SyntaxNode(kind, value, argType, newChildren);
    }

    public boolean isKind(String expected) {
        return expected.equals(kind);
    }

    /**
     * Number of nodes in this subtree, this node included.
     */
    public int size() {
        return 1 + (int) children.sumOfInt(SyntaxNode::size);
    }

    /**
     * The label this node carries on a linearized sequence: {@code KIND} when the value is
     * empty, {@code KIND_value} otherwise and {@code ARGUMENT_type_value} for arguments.
     */
    public String symbol() {
        String label = kind == null ? "" : kind.toUpperCase(Locale.ROOT);
        if (NodeKinds.ARGUMENT.equals(kind)) {
            String type = argType.isEmpty() ? UNKNOWN_TYPE : argType;
            return label + SYMBOL_SEPARATOR + type + SYMBOL_SEPARATOR + nullToEmpty(value);
        }
        if (value == null || value.isEmpty()) {
            return label;
        }
        return label + SYMBOL_SEPARATOR + value;
    }

    /**
     * Builds a childless node from a symbol produced by {@link #symbol()}.
     */
    public static SyntaxNode fromSymbol(String symbol) {
        int split = symbol.indexOf(SYMBOL_SEPARATOR);
        if (split < 0) {
            return of(symbol.toLowerCase(Locale.ROOT), "");
        }
        String kind = symbol.substring(0, split).toLowerCase(Locale.ROOT);
        String rest = symbol.substring(split + 1);
        if (!NodeKinds.ARGUMENT.equals(kind)) {
            return of(kind, rest);
        }
        int typeEnd = rest.indexOf(SYMBOL_SEPARATOR);
        if (typeEnd < 0) {
            return argument(rest, UNKNOWN_TYPE);
        }
        return argument(rest.substring(typeEnd + 1), rest.substring(0, typeEnd));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
