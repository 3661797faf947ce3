package com.nlbash.nl;

/**
 * Corrects the spelling of a word. Returns the word unchanged when no correction is known.
 */
@FunctionalInterface
public interface SpellCorrector {
    String correct(String word);

    static SpellCorrector identity() {
        return word -> word;
    }
}
