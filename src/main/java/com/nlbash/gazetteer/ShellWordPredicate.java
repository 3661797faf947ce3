package com.nlbash.gazetteer;

/**
 * Decides whether a token can stand in a normalized sentence as-is. Tokens that are not
 * recognized get quoted.
 */
@FunctionalInterface
public interface ShellWordPredicate {
    boolean isShellWord(String token);

    static ShellWordPredicate standard() {
        return ShellWords::isShellWord;
    }
}
