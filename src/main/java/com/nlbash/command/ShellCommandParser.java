package com.nlbash.command;

import com.nlbash.ast.NodeKinds;
import com.nlbash.ast.SyntaxNode;
import com.nlbash.gazetteer.ShellWords;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for the common subset of shell syntax found in one-line commands: lists joined by
 * {@code &&}, {@code ||}, {@code ;} and {@code &}, pipelines, flags, {@code --name=value} flags,
 * single and double quotes and backslash escapes.
 *
 * <p>Tree shape: {@code root} holds the commands of the list with {@code operator} nodes between
 * them; a command is a {@code utility} or, for {@code a | b}, a {@code pipeline} of utilities.
 * A utility's children are its {@code flag} and {@code argument} nodes in command-line order.
 */
public class ShellCommandParser implements CommandParser {
    private static final Logger logger = LoggerFactory.getLogger(ShellCommandParser.class);

    public static final String TYPE_NUMBER = "Number";
    public static final String TYPE_FILE = "File";
    public static final String TYPE_PATTERN = "Pattern";

    private static final String PIPE = "|";

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern PATTERN_CHARS = Pattern.compile("[*?\\[\\]^$\\\\{}|]");
    private static final Pattern FILE_NAME = Pattern.compile("[\\w-]+\\.\\w+");

    @Override
    public SyntaxNode parse(String command, ParseOptions options) {
        if (command == null || command.isBlank()) {
            throw new ShellParseException("Empty command", String.valueOf(command));
        }

        List<Word> words = new Lexer(command).lex();
        MutableList<SyntaxNode> children = Lists.mutable.empty();
        MutableList<Word> current = Lists.mutable.empty();
        Word lastOperator = null;

        for (Word word : words) {
            if (word.operator() && !PIPE.equals(word.text())) {
                if (current.isEmpty()) {
                    throw new ShellParseException("Unexpected '" + word.text() + "'", command);
                }
                children.add(parsePipeline(current, command, options));
                children.add(SyntaxNode.of(NodeKinds.OPERATOR, word.text()));
                current = Lists.mutable.empty();
                lastOperator = word;
            } else {
                current.add(word);
            }
        }

        if (!current.isEmpty()) {
            children.add(parsePipeline(current, command, options));
        } else if (lastOperator != null && lastOperator.text().length() > 1) {
            // "a ;" and "a &" are complete, "a &&" is not
            throw new ShellParseException("Dangling '" + lastOperator.text() + "'", command);
        }

        SyntaxNode root = SyntaxNode.root().withChildren(children.toImmutable());
        logger.debug("Parsed '{}' into {} nodes", command, root.size());
        return root;
    }

    private SyntaxNode parsePipeline(List<Word> words, String command, ParseOptions options) {
        MutableList<SyntaxNode> stages = Lists.mutable.empty();
        MutableList<Word> stage = Lists.mutable.empty();
        for (Word word : words) {
            if (word.operator()) {
                if (stage.isEmpty()) {
                    throw new ShellParseException("Empty pipeline stage", command);
                }
                stages.add(parseUtility(stage, options));
                stage = Lists.mutable.empty();
            } else {
                stage.add(word);
            }
        }
        if (stage.isEmpty()) {
            throw new ShellParseException("Empty pipeline stage", command);
        }
        stages.add(parseUtility(stage, options));

        if (stages.size() == 1) {
            return stages.getFirst();
        }
        return SyntaxNode.of(NodeKinds.PIPELINE, "").withChildren(stages.toImmutable());
    }

    private SyntaxNode parseUtility(List<Word> words, ParseOptions options) {
        MutableList<SyntaxNode> children = Lists.mutable.empty();
        for (Word word : words.subList(1, words.size())) {
            children.add(parseWord(word, options));
        }
        return SyntaxNode.of(NodeKinds.UTILITY, words.get(0).text()).withChildren(children.toImmutable());
    }

    private SyntaxNode parseWord(Word word, ParseOptions options) {
        String text = word.text();
        String raw = word.raw();
        int equals = raw.indexOf('=');
        // --name=value where only the value may be quoted
        if (raw.startsWith("--") && equals > 2 && isPlain(raw.substring(0, equals))) {
            String name = raw.substring(0, equals);
            Word value = new Word(text.substring(equals + 1), raw.substring(equals + 1), word.quoted(), false);
            return SyntaxNode.of(NodeKinds.FLAG, name).with(parseArgument(value, options));
        }
        if (!word.quoted() && text.length() > 1 && text.startsWith("-") && !NUMBER.matcher(text).matches()) {
            return SyntaxNode.of(NodeKinds.FLAG, text);
        }
        return parseArgument(word, options);
    }

    private SyntaxNode parseArgument(Word word, ParseOptions options) {
        String text = word.text();
        String type = inferType(text, word.quoted());
        String value = options.recoverQuotation() && word.quoted() ? word.raw() : text;

        if (options.normalizeLongPattern() && word.quoted() && text.indexOf(' ') >= 0) {
            return SyntaxNode.argument(ShellWords.LONG_PATTERN, TYPE_PATTERN);
        }
        if (options.normalizeDigits() && !value.startsWith("-")) {
            value = ShellWords.normalizeDigits(value);
        }
        return SyntaxNode.argument(value, type);
    }

    private static boolean isPlain(String raw) {
        return raw.indexOf('"') < 0 && raw.indexOf('\'') < 0 && raw.indexOf('\\') < 0;
    }

    static String inferType(String text, boolean quoted) {
        if (NUMBER.matcher(text).matches()) {
            return TYPE_NUMBER;
        }
        if (quoted || PATTERN_CHARS.matcher(text).find()) {
            return TYPE_PATTERN;
        }
        if (text.indexOf('/') >= 0 || text.startsWith(".") || text.startsWith("~")
                || FILE_NAME.matcher(text).matches()) {
            return TYPE_FILE;
        }
        return SyntaxNode.UNKNOWN_TYPE;
    }

    /**
     * A lexed word. {@code text} has quotes and escapes removed, {@code raw} is as written.
     */
    record Word(String text, String raw, boolean quoted, boolean operator) {
        static Word operator(String op) {
            return new Word(op, op, false, true);
        }
    }

    private static final class Lexer {
        private final String command;
        private final MutableList<Word> words = Lists.mutable.empty();
        private final StringBuilder text = new StringBuilder();
        private final StringBuilder raw = new StringBuilder();
        private boolean quoted;

        Lexer(String command) {
            this.command = command;
        }

        List<Word> lex() {
            int n = command.length();
            char quote = 0;
            int i = 0;
            while (i < n) {
                char c = command.charAt(i);
                char next = i + 1 < n ? command.charAt(i + 1) : 0;

                if (quote != 0) {
                    raw.append(c);
                    if (c == quote) {
                        quote = 0;
                    } else if (c == '\\' && quote == '"' && next != 0 && "\\\"$`".indexOf(next) >= 0) {
                        text.append(next);
                        raw.append(next);
                        i++;
                    } else {
                        text.append(c);
                    }
                } else if (c == '\'' || c == '"') {
                    quote = c;
                    quoted = true;
                    raw.append(c);
                } else if (c == '\\' && next != 0) {
                    text.append(next);
                    raw.append(c).append(next);
                    i++;
                } else if (Character.isWhitespace(c)) {
                    flush();
                } else if (c == '&' && endsWithRedirect()) {
                    // 2>&1
                    text.append(c);
                    raw.append(c);
                } else if (c == '|' || c == '&' || c == ';') {
                    flush();
                    String op = (c != ';' && next == c) ? "" + c + c : String.valueOf(c);
                    words.add(Word.operator(op));
                    i += op.length();
                    continue;
                } else {
                    text.append(c);
                    raw.append(c);
                }
                i++;
            }

            if (quote != 0) {
                throw new ShellParseException("Unterminated quotation", command);
            }
            flush();
            return words;
        }

        private boolean endsWithRedirect() {
            int len = raw.length();
            return len > 0 && (raw.charAt(len - 1) == '>' || raw.charAt(len - 1) == '<');
        }

        private void flush() {
            if (raw.length() > 0) {
                words.add(new Word(text.toString(), raw.toString(), quoted, false));
            }
            text.setLength(0);
            raw.setLength(0);
            quoted = false;
        }
    }
}
