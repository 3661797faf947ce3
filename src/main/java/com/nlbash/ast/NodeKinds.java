package com.nlbash.ast;

/**
 * Kind tags produced by the default shell parser.
 */
public final class NodeKinds {
    public static final String ROOT = "root";
    public static final String PIPELINE = "pipeline";
    public static final String UTILITY = "utility";
    public static final String FLAG = "flag";
    public static final String ARGUMENT = "argument";
    public static final String OPERATOR = "operator";

    private NodeKinds() {
    }
}
