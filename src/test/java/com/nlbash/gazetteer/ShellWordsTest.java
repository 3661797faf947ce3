package com.nlbash.gazetteer;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ShellWordsTest {

    @ParameterizedTest
    @CsvSource({
        "ls, true",
        "-la, true",
        "(, true",
        "dir_NUM, true",
        "_LONG_PATTERN, true",
        "/tmp, false",
        "*.txt, false",
        "foo_bar, false",
        "'a b', false"
    })
    public void testStandardPredicate(String token, boolean expected) {
        assertEquals(expected, ShellWordPredicate.standard().isShellWord(token));
    }

    @Test
    public void testNormalizeDigits() {
        assertEquals("file_NUM.txt_NUM", ShellWords.normalizeDigits("file10.txt2"));
        assertEquals("dir", ShellWords.normalizeDigits("dir"));
        assertTrue(ShellWords.isNumber("42"));
        assertFalse(ShellWords.isNumber("4a"));
    }
}
