package com.nlbash.nl;

/**
 * Reduces an English word to its lemma. Returns the word unchanged when it is unknown.
 */
@FunctionalInterface
public interface Lemmatizer {
    String lemmatize(String word);

    static Lemmatizer identity() {
        return word -> word;
    }
}
