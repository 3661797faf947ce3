package com.nlbash.nl;

import com.nlbash.gazetteer.Gazetteer;
import com.nlbash.gazetteer.ShellWordPredicate;
import com.nlbash.gazetteer.ShellWords;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizes English descriptions of shell commands into normalized word tokens.
 *
 * <p>The sentence is first canonicalized (quote glyphs, parentheses, list punctuation,
 * contractions), split into words and quoted spans, and then every word goes through the
 * same fixed sequence of steps: case folding, lemmatization, spelling correction, stopword
 * removal, number words, quoting of non-shell words, long-pattern collapsing, digit
 * normalization and possessive splitting.
 */
public class LexicalNormalizer {
    public static final String POSSESSIVE = "'s";

    // A word is a run of characters other than space, comma and quote; a double-quoted span is
    // one unit. A quote that opens a word and is never closed runs to the end of the sentence,
    // a stray quote inside a word is dropped
    private static final Pattern WORD_SPLIT_RESPECT_QUOTES = Pattern.compile(
            "(?:[^\\s,\"]|\"(?:\\\\.|[^\"\\\\])*+\"|(?<![^\\s,])\"(?:\\\\.|[^\"\\\\])*+$)+");

    private static final Pattern LEADING_APOSTROPHE = Pattern.compile("^'");
    private static final Pattern TRAILING_APOSTROPHE = Pattern.compile("'$");

    private static final Pattern[] LIST_PUNCTUATION = {
        Pattern.compile("(,\\s+)|(,$)"),
        Pattern.compile("(;\\s+)|(;$)"),
        Pattern.compile("(:\\s+)|(:$)"),
        Pattern.compile("(\\.\\s+)|(\\.$)")
    };

    private static final String[] CONTRACTIONS = {"'s", "'re", "'ve", "'d", "'t"};

    private final Gazetteer gazetteer;
    private final ShellWordPredicate shellWords;
    private final Lemmatizer lemmatizer;
    private final SpellCorrector spellCorrector;
    private final NormalizationListener listener;

    public LexicalNormalizer(Gazetteer gazetteer,
                             ShellWordPredicate shellWords,
                             Lemmatizer lemmatizer,
                             SpellCorrector spellCorrector,
                             NormalizationListener listener) {
        this.gazetteer = gazetteer;
        this.shellWords = shellWords;
        this.lemmatizer = lemmatizer;
        this.spellCorrector = spellCorrector;
        this.listener = listener;
    }

    /**
     * A normalizer with the bundled lemmatizer and spelling corrector, logging its side effects.
     */
    public static LexicalNormalizer standard(Gazetteer gazetteer) {
        return new LexicalNormalizer(gazetteer,
                ShellWordPredicate.standard(),
                new SuffixLemmatizer(),
                new NorvigSpellCorrector(gazetteer.vocabulary()),
                new LoggingNormalizationListener());
    }

    public List<String> normalize(String sentence, NormalizationConfig config) {
        String canonical = escapeContractions(collapseListPunctuation(canonicalizeQuotes(sentence)));

        MutableList<String> normalizedWords = Lists.mutable.empty();
        for (String raw : split(canonical)) {
            String word = raw.strip();
            if (word.isEmpty()) {
                continue;
            }

            // Acronyms keep their case
            if (config.lowerCase() && isTitleCase(word)) {
                word = word.toLowerCase(Locale.ROOT);
            }

            if (config.lemmatization()) {
                word = lemmatizer.lemmatize(word);
            }

            if (config.spellCorrection() && isAlphabetic(word)) {
                String before = word;
                word = spellCorrector.correct(word);
                if (!word.equals(before)) {
                    listener.onSpellCorrection(before, word);
                }
            }

            if (config.removeStopWords() && gazetteer.isStopword(word)) {
                continue;
            }

            word = gazetteer.numberFor(word).orElse(word);

            // Multi-word tokens are checked as split, before quoting could close them
            if (isLongPattern(word)) {
                if (QuoteShape.of(word) != QuoteShape.QUOTED) {
                    listener.onQuotationViolation(new QuotationViolation(word, canonical));
                } else if (config.normalizeLongPattern()) {
                    word = ShellWords.LONG_PATTERN;
                }
            } else {
                word = quoteUnrecognized(word);
            }

            // Leading '-' marks a negative number or a flag
            if (config.normalizeDigits() && !word.startsWith("-")) {
                word = ShellWords.normalizeDigits(word);
            }

            if (word.endsWith(POSSESSIVE)) {
                String stem = word.substring(0, word.length() - POSSESSIVE.length());
                if (!stem.isEmpty()) {
                    normalizedWords.add(stem);
                }
                normalizedWords.add(POSSESSIVE);
            } else {
                normalizedWords.add(word);
            }
        }
        return normalizedWords;
    }

    /**
     * This normalizer as a {@link WordTokenizer}; the two per-call switches override the
     * matching ones of {@code config}.
     */
    public WordTokenizer asWordTokenizer(NormalizationConfig config) {
        return (text, normalizeDigits, normalizeLongPattern) -> normalize(text, config
                .withNormalizeDigits(normalizeDigits)
                .withNormalizeLongPattern(normalizeLongPattern));
    }

    static String canonicalizeQuotes(String sentence) {
        String s = sentence.replace("`'", "\"")
                .replace("``", "\"")
                .replace("''", "\"")
                .replace(" '", " \"")
                .replace("' ", "\" ")
                .replace("`", "\"")
                .replace("(", "( ")
                .replace(")", " )");
        s = LEADING_APOSTROPHE.matcher(s).replaceFirst("\"");
        return TRAILING_APOSTROPHE.matcher(s).replaceFirst("\"");
    }

    // TODO: sentence-final punctuation is dropped here; decide whether '.', ':' and ';' should
    // survive as tokens once downstream vocabularies are rebuilt
    static String collapseListPunctuation(String sentence) {
        String s = sentence;
        for (Pattern punctuation : LIST_PUNCTUATION) {
            s = punctuation.matcher(s).replaceAll(" ");
        }
        return s;
    }

    static String escapeContractions(String sentence) {
        String s = sentence;
        for (String contraction : CONTRACTIONS) {
            s = s.replace(contraction, "\\" + contraction);
        }
        return s;
    }

    static List<String> split(String sentence) {
        MutableList<String> words = Lists.mutable.empty();
        Matcher matcher = WORD_SPLIT_RESPECT_QUOTES.matcher(sentence);
        while (matcher.find()) {
            words.add(unescapeContractions(matcher.group()));
        }
        return words;
    }

    private static String unescapeContractions(String word) {
        String w = word;
        for (String contraction : CONTRACTIONS) {
            w = w.replace("\\" + contraction, contraction);
        }
        return w;
    }

    private String quoteUnrecognized(String word) {
        if (shellWords.isShellWord(word)) {
            return word;
        }
        return switch (QuoteShape.of(word)) {
            case BARE -> "\"" + word + (word.endsWith("\"") ? "" : "\"");
            case OPEN -> word + "\"";
            case QUOTED -> word;
        };
    }

    private static boolean isLongPattern(String word) {
        return word.indexOf(' ') >= 0 && word.length() > 3;
    }

    /**
     * First character upper case, the rest has cased characters and all of them lower case.
     */
    static boolean isTitleCase(String word) {
        if (word.length() < 2 || !Character.isUpperCase(word.charAt(0))) {
            return false;
        }
        boolean cased = false;
        for (int i = 1; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                return false;
            }
            if (Character.isLowerCase(c)) {
                cased = true;
            }
        }
        return cased;
    }

    static boolean isAlphabetic(String word) {
        return !word.isEmpty() && word.codePoints().allMatch(Character::isLetter);
    }
}
