package com.nlbash.nl;

/**
 * How a token is wrapped in double quotes.
 */
enum QuoteShape {
    /** Does not start with a quote. */
    BARE,
    /** Starts with a quote that is never closed. */
    OPEN,
    /** Starts and ends with a quote. */
    QUOTED;

    static QuoteShape of(String token) {
        if (!token.startsWith("\"")) {
            return BARE;
        }
        return token.length() > 1 && token.endsWith("\"") ? QUOTED : OPEN;
    }
}
