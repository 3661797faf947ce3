package com.nlbash.command;

/**
 * @param normalizeDigits      replace digit runs in argument values with {@code _NUM}
 * @param normalizeLongPattern replace quoted multi-word arguments with {@code _LONG_PATTERN}
 * @param recoverQuotation     keep the quotes of quoted arguments in their values
 */
public record ParseOptions(boolean normalizeDigits, boolean normalizeLongPattern, boolean recoverQuotation) {

    public static ParseOptions defaults() {
        return new ParseOptions(true, true, true);
    }

    /**
     * Arguments exactly as written, quotes included.
     */
    public static ParseOptions verbatim() {
        return new ParseOptions(false, false, true);
    }
}
