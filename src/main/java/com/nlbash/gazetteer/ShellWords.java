package com.nlbash.gazetteer;

import java.util.regex.Pattern;

/**
 * Placeholder tokens and token shapes shared by the natural-language and command tokenizers.
 */
public final class ShellWords {
    public static final String NUM = "_NUM";
    public static final String LONG_PATTERN = "_LONG_PATTERN";

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    // _NUM fragments are accepted so already normalized tokens stay unquoted
    private static final Pattern SHELL_WORD = Pattern.compile("(?:[0-9A-Za-z\\-'()]|_NUM)+");

    private ShellWords() {
    }

    public static boolean isShellWord(String token) {
        return LONG_PATTERN.equals(token) || SHELL_WORD.matcher(token).matches();
    }

    /**
     * Replaces every run of digits with {@link #NUM}.
     */
    public static String normalizeDigits(String token) {
        return DIGITS.matcher(token).replaceAll(NUM);
    }

    public static boolean isNumber(String token) {
        return DIGITS.matcher(token).matches();
    }
}
