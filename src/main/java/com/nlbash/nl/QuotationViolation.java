package com.nlbash.nl;

/**
 * A multi-word token that reached the long-pattern check without being a closed quoted span.
 *
 * @param token    the offending token
 * @param sentence the sentence it came from, after punctuation canonicalization
 */
public record QuotationViolation(String token, String sentence) {
}
