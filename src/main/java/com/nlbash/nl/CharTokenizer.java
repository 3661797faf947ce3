package com.nlbash.nl;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Breaks the output of a word tokenizer down into single characters for character-level
 * models, with {@link #SPACE} between consecutive words.
 */
public class CharTokenizer {
    public static final String SPACE = "<SPACE>";

    /**
     * Characters of the whole sentence taken as a single word.
     */
    public List<String> tokenize(String sentence) {
        return tokenize(sentence, null);
    }

    /**
     * @param base word tokenizer run first, always with digit and long-pattern normalization
     *             off; {@code null} takes the sentence as one word
     */
    public List<String> tokenize(String sentence, WordTokenizer base) {
        List<String> words = base != null ? base.tokenize(sentence, false, false) : List.of(sentence);

        MutableList<String> chars = Lists.mutable.empty();
        for (int i = 0; i < words.size(); i++) {
            if (i > 0) {
                chars.add(SPACE);
            }
            words.get(i).codePoints().forEach(c -> chars.add(new String(Character.toChars(c))));
        }
        return chars;
    }
}
