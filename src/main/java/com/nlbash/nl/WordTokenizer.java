package com.nlbash.nl;

import java.util.List;

/**
 * A word-level tokenizer with the two normalizations that callers toggle per call.
 */
@FunctionalInterface
public interface WordTokenizer {
    List<String> tokenize(String text, boolean normalizeDigits, boolean normalizeLongPattern);
}
