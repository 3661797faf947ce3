package com.nlbash.nl;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Comparator;

/**
 * Frequency-based spelling corrector: a known word is kept, otherwise the most frequent known
 * word at edit distance one, then two, wins. Words with no known candidate are kept.
 */
public class NorvigSpellCorrector implements SpellCorrector {
    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyz";

    private final ImmutableMap<String, Integer> vocabulary;
    // Highest frequency first, ties broken alphabetically
    private final Comparator<String> byFrequency;

    public NorvigSpellCorrector(ImmutableMap<String, Integer> vocabulary) {
        this.vocabulary = vocabulary;
        this.byFrequency = Comparator.<String>comparingInt(vocabulary::get)
                .thenComparing(Comparator.<String>reverseOrder());
    }

    @Override
    public String correct(String word) {
        if (vocabulary.isEmpty() || vocabulary.containsKey(word)) {
            return word;
        }
        MutableSet<String> distanceOne = edits(word);
        MutableSet<String> candidates = distanceOne.select(vocabulary::containsKey);
        if (candidates.isEmpty()) {
            for (String edit : distanceOne) {
                edits(edit).select(vocabulary::containsKey, candidates);
            }
        }
        return candidates.isEmpty() ? word : candidates.max(byFrequency);
    }

    private MutableSet<String> edits(String word) {
        MutableSet<String> result = Sets.mutable.empty();
        int n = word.length();
        for (int i = 0; i <= n; i++) {
            String left = word.substring(0, i);
            String right = word.substring(i);
            if (!right.isEmpty()) {
                result.add(left + right.substring(1));
            }
            if (right.length() > 1) {
                result.add(left + right.charAt(1) + right.charAt(0) + right.substring(2));
            }
            for (int c = 0; c < LETTERS.length(); c++) {
                char letter = LETTERS.charAt(c);
                if (!right.isEmpty()) {
                    result.add(left + letter + right.substring(1));
                }
                result.add(left + letter + right);
            }
        }
        return result;
    }
}
