package com.nlbash.command;

import com.nlbash.ast.SyntaxNode;

import java.util.List;

/**
 * Turns a syntax tree back into command tokens.
 */
@FunctionalInterface
public interface CommandRenderer {
    List<String> render(SyntaxNode node, RenderOptions options);
}
