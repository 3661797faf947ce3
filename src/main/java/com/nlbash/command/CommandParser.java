package com.nlbash.command;

import com.nlbash.ast.SyntaxNode;

/**
 * Turns shell command text into a syntax tree rooted at a {@code root} node.
 */
@FunctionalInterface
public interface CommandParser {
    /**
     * @throws ShellParseException if the text is not a well-formed command
     */
    SyntaxNode parse(String command, ParseOptions options);
}
