package com.nlbash;

import com.nlbash.ast.SyntaxNode;
import com.nlbash.ast.TreeLinearizer;
import com.nlbash.command.CommandNormalizer;
import com.nlbash.gazetteer.Gazetteer;
import com.nlbash.gazetteer.GazetteerLoader;
import com.nlbash.nl.CharTokenizer;
import com.nlbash.nl.LexicalNormalizer;
import com.nlbash.nl.NormalizationConfig;
import com.nlbash.output.PrettyPrinter;
import com.nlbash.output.SequenceFormatter;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "nlbash", mixinStandardHelpOptions = true, version = "1.0",
         description = "Tokenize natural language and shell commands, linearize command trees and print templates")
public class NLBash implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(NLBash.class);

    enum Mode { command, nl, chars }

    @Parameters(index = "0", arity = "0..1", description = "Text to process (default: one per line from stdin)")
    private String text;

    @Option(names = {"-m", "--mode"},
            description = "Input kind: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Mode mode = Mode.command;

    @Option(names = {"-j", "--json"}, description = "Print token sequences as JSON arrays")
    private boolean json = false;

    @Option(names = "--gazetteer", description = "Gazetteer JSON file (default: bundled)")
    private File gazetteerFile;

    @Option(names = "--no-lower-case", description = "Keep capitalized words as written")
    private boolean noLowerCase = false;

    @Option(names = "--no-lemmatize", description = "Do not lemmatize words")
    private boolean noLemmatize = false;

    @Option(names = "--no-spell-check", description = "Do not correct spelling")
    private boolean noSpellCheck = false;

    @Option(names = "--keep-stopwords", description = "Keep English stopwords")
    private boolean keepStopwords = false;

    @Option(names = "--no-digits", description = "Keep digits instead of _NUM")
    private boolean noDigits = false;

    @Option(names = "--no-long-pattern", description = "Keep quoted multi-word spans instead of _LONG_PATTERN")
    private boolean noLongPattern = false;

    @Spec
    private CommandSpec spec;

    private final InputStream input;

    private final TreeLinearizer linearizer = new TreeLinearizer();
    private final PrettyPrinter prettyPrinter = new PrettyPrinter();
    private final CharTokenizer charTokenizer = new CharTokenizer();
    private final CommandNormalizer commandNormalizer = CommandNormalizer.standard();

    public NLBash() {
        this(System.in);
    }

    NLBash(InputStream input) {
        this.input = input;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NLBash()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        LexicalNormalizer normalizer;
        try {
            normalizer = LexicalNormalizer.standard(loadGazetteer());
        } catch (IOException | UncheckedIOException e) {
            logger.debug("Failed to load gazetteer", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
        NormalizationConfig config = new NormalizationConfig(!noLowerCase, !noLemmatize, !noSpellCheck,
                !keepStopwords, !noDigits, !noLongPattern);
        SequenceFormatter formatter = new SequenceFormatter(json);

        if (text != null) {
            try {
                process(text, normalizer, config, formatter, out);
                return 0;
            } catch (RuntimeException e) {
                logger.debug("Failed to process '{}'", text, e);
                err.println("Error: " + e.getMessage());
                return 1;
            } finally {
                out.flush();
                err.flush();
            }
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        boolean interactive = System.console() != null;
        while (true) {
            if (interactive) {
                out.print(mode == Mode.command ? "Bash command: " : "Sentence: ");
                out.flush();
            }
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            if (line.isBlank()) {
                continue;
            }
            try {
                process(line, normalizer, config, formatter, out);
            } catch (RuntimeException e) {
                logger.debug("Failed to process '{}'", line, e);
                err.println("Error: " + e.getMessage());
            }
            out.flush();
        }
        return 0;
    }

    private void process(String line, LexicalNormalizer normalizer, NormalizationConfig config,
                         SequenceFormatter formatter, PrintWriter out) {
        switch (mode) {
            case nl -> out.println(formatter.format(normalizer.normalize(line, config)));
            case chars -> out.println(formatter.format(
                    charTokenizer.tokenize(line, normalizer.asWordTokenizer(config))));
            case command -> processCommand(line, formatter, out);
        }
    }

    private void processCommand(String line, SequenceFormatter formatter, PrintWriter out) {
        SyntaxNode tree = commandNormalizer.parse(line);
        out.println();
        out.println("AST:");
        out.print(prettyPrinter.print(tree));

        MutableList<String> sequence = Lists.mutable.withAll(linearizer.linearize(tree));
        out.println();
        out.println("Linearized:");
        out.println(formatter.format(sequence));

        // Decoders may still emit the legacy padding symbol after the sequence
        sequence.add(TreeLinearizer.PAD);
        SyntaxNode restored = linearizer.delinearize(sequence).orElse(tree);
        if (!restored.equals(tree)) {
            logger.warn("Linearization round trip changed the tree of '{}'", line);
        }

        out.println();
        out.println("Command Template (flags in alphabetical order):");
        out.println(commandNormalizer.toTemplate(restored));
        out.println();
    }

    private Gazetteer loadGazetteer() throws IOException {
        GazetteerLoader loader = new GazetteerLoader();
        if (gazetteerFile == null) {
            return loader.loadDefault();
        }
        try (InputStream in = new FileInputStream(gazetteerFile)) {
            return loader.load(in);
        }
    }
}
