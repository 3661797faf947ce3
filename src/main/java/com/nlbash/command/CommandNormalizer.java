package com.nlbash.command;

import com.nlbash.ast.SyntaxNode;
import com.nlbash.nl.WordTokenizer;

import java.util.List;

/**
 * Front end over a {@link CommandParser} and a {@link CommandRenderer}: command text to tree,
 * tree to tokens, command strings and templates.
 *
 * <p>A template is the rendering of a tree with flags in alphabetical order and, usually,
 * arguments replaced by their type, e.g. {@code ls -l -a /tmp} gives {@code ls -a -l File}.
 */
public class CommandNormalizer implements WordTokenizer {
    private final CommandParser parser;
    private final CommandRenderer renderer;

    public CommandNormalizer(CommandParser parser, CommandRenderer renderer) {
        this.parser = parser;
        this.renderer = renderer;
    }

    public static CommandNormalizer standard() {
        return new CommandNormalizer(new ShellCommandParser(), new TokenRenderer());
    }

    public SyntaxNode parse(String command) {
        return parse(command, ParseOptions.defaults());
    }

    public SyntaxNode parse(String command, ParseOptions options) {
        return parser.parse(command, options);
    }

    /**
     * Parses and renders back, with quotation recovery on.
     */
    @Override
    public List<String> tokenize(String command, boolean normalizeDigits, boolean normalizeLongPattern) {
        SyntaxNode tree = parse(command, new ParseOptions(normalizeDigits, normalizeLongPattern, true));
        return toTokens(tree, RenderOptions.defaults());
    }

    public List<String> toTokens(SyntaxNode node, RenderOptions options) {
        return renderer.render(node, options);
    }

    public List<String> toTokens(SyntaxNode node, boolean looseConstraints, boolean ignoreFlagOrder) {
        return toTokens(node, new RenderOptions(looseConstraints, ignoreFlagOrder, false));
    }

    public String toCommand(SyntaxNode node, boolean looseConstraints, boolean ignoreFlagOrder) {
        return String.join(" ", toTokens(node, looseConstraints, ignoreFlagOrder));
    }

    public String toTemplate(SyntaxNode node, boolean looseConstraints, boolean argTypeOnly) {
        return String.join(" ", toTokens(node, RenderOptions.template(looseConstraints, argTypeOnly)));
    }

    public String toTemplate(SyntaxNode node) {
        return toTemplate(node, false, true);
    }

    public String commandToTemplate(String command, ParseOptions options, boolean looseConstraints, boolean argTypeOnly) {
        return toTemplate(parse(command, options), looseConstraints, argTypeOnly);
    }

    public String commandToTemplate(String command) {
        return commandToTemplate(command, ParseOptions.defaults(), false, true);
    }
}
