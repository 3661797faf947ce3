package com.nlbash.nl;

/**
 * Receives the observable side effects of normalizing a sentence.
 */
public interface NormalizationListener {
    void onSpellCorrection(String before, String after);

    void onQuotationViolation(QuotationViolation violation);
}
