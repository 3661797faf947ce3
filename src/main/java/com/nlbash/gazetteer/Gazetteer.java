package com.nlbash.gazetteer;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Optional;

/**
 * Static word tables used by the natural-language normalizer.
 *
 * @param stopwords   English words dropped when stopword removal is on
 * @param numberWords number words and the value they stand for
 * @param vocabulary  known words with their corpus frequency, used for spelling correction
 */
public record Gazetteer(ImmutableSet<String> stopwords,
                        ImmutableMap<String, Long> numberWords,
                        ImmutableMap<String, Integer> vocabulary) {

    public Gazetteer {
        stopwords = stopwords == null ? Sets.immutable.empty() : stopwords;
        numberWords = numberWords == null ? Maps.immutable.empty() : numberWords;
        vocabulary = vocabulary == null ? Maps.immutable.empty() : vocabulary;
    }

    public static Gazetteer empty() {
        return new Gazetteer(null, null, null);
    }

    public boolean isStopword(String word) {
        return stopwords.contains(word);
    }

    /**
     * The digit string for a number word, e.g. {@code "three" -> "3"}.
     */
    public Optional<String> numberFor(String word) {
        Long number = numberWords.get(word);
        return number == null ? Optional.empty() : Optional.of(Long.toString(number));
    }
}
