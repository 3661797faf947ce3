package com.nlbash.nl;

/**
 * Switches of the natural-language normalizer. Each one is independent of the others.
 *
 * @param lowerCase            lower-case words written with a single initial capital
 * @param lemmatization        reduce words to their lemma
 * @param spellCorrection      correct the spelling of purely alphabetic words
 * @param removeStopWords      drop English stopwords
 * @param normalizeDigits      replace digit runs with {@code _NUM}
 * @param normalizeLongPattern replace quoted multi-word spans with {@code _LONG_PATTERN}
 */
public record NormalizationConfig(boolean lowerCase,
                                  boolean lemmatization,
                                  boolean spellCorrection,
                                  boolean removeStopWords,
                                  boolean normalizeDigits,
                                  boolean normalizeLongPattern) {

    public static NormalizationConfig defaults() {
        return new NormalizationConfig(true, true, true, true, true, true);
    }

    /**
     * Every switch off: the sentence is only split and quoted.
     */
    public static NormalizationConfig none() {
        return new NormalizationConfig(false, false, false, false, false, false);
    }

    public NormalizationConfig withLowerCase(boolean enabled) {
        return new NormalizationConfig(enabled, lemmatization, spellCorrection, removeStopWords,
                normalizeDigits, normalizeLongPattern);
    }

    public NormalizationConfig withLemmatization(boolean enabled) {
        return new NormalizationConfig(lowerCase, enabled, spellCorrection, removeStopWords,
                normalizeDigits, normalizeLongPattern);
    }

    public NormalizationConfig withSpellCorrection(boolean enabled) {
        return new NormalizationConfig(lowerCase, lemmatization, enabled, removeStopWords,
                normalizeDigits, normalizeLongPattern);
    }

    public NormalizationConfig withRemoveStopWords(boolean enabled) {
        return new NormalizationConfig(lowerCase, lemmatization, spellCorrection, enabled,
                normalizeDigits, normalizeLongPattern);
    }

    public NormalizationConfig withNormalizeDigits(boolean enabled) {
        return new NormalizationConfig(lowerCase, lemmatization, spellCorrection, removeStopWords,
                enabled, normalizeLongPattern);
    }

    public NormalizationConfig withNormalizeLongPattern(boolean enabled) {
        return new NormalizationConfig(lowerCase, lemmatization, spellCorrection, removeStopWords,
                normalizeDigits, enabled);
    }
}
