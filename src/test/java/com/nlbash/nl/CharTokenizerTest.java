package com.nlbash.nl;

import com.nlbash.gazetteer.Gazetteer;
import com.nlbash.gazetteer.ShellWordPredicate;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CharTokenizerTest {
    private static final String SPACE = CharTokenizer.SPACE;

    private final CharTokenizer tokenizer = new CharTokenizer();

    @Test
    public void testWholeSentenceWithoutBaseTokenizer() {
        assertEquals(List.of("a", "b", " ", "c"), tokenizer.tokenize("ab c"));
    }

    @Test
    public void testSeparatorBetweenWordsOnly() {
        WordTokenizer base = (text, digits, longPattern) -> List.of(text.split(" "));
        assertEquals(List.of("l", "s", SPACE, "-", "a", SPACE, "x"), tokenizer.tokenize("ls -a x", base));
    }

    @Test
    public void testBaseTokenizerRunsWithoutDigitOrLongPatternNormalization() {
        MutableList<Boolean> flags = Lists.mutable.empty();
        WordTokenizer base = (text, digits, longPattern) -> {
            flags.add(digits);
            flags.add(longPattern);
            return List.of(text);
        };

        tokenizer.tokenize("cd dir1", base);

        assertEquals(List.of(false, false), flags);
    }

    @Test
    public void testEmptyTokenList() {
        assertEquals(List.of(), tokenizer.tokenize("the", (text, digits, longPattern) -> List.of()));
        assertEquals(List.of(), tokenizer.tokenize(""));
    }

    @Test
    public void testSupplementaryCharactersStayWhole() {
        assertEquals(List.of("a", "😀"), tokenizer.tokenize("a😀"));
    }

    @Test
    public void testOverLexicalNormalizer() {
        LexicalNormalizer normalizer = new LexicalNormalizer(Gazetteer.empty(), ShellWordPredicate.standard(),
                Lemmatizer.identity(), SpellCorrector.identity(), new LoggingNormalizationListener());

        List<String> chars = tokenizer.tokenize("copy 2 files",
                normalizer.asWordTokenizer(NormalizationConfig.defaults()));

        assertEquals(List.of("c", "o", "p", "y", SPACE, "2", SPACE, "f", "i", "l", "e", "s"), chars);
    }
}
