package com.nlbash.gazetteer;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class GazetteerLoaderTest {
    private final GazetteerLoader loader = new GazetteerLoader();

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testLoad() throws IOException {
        Gazetteer gazetteer = loader.load(json("{\"stopwords\":[\"a\",\"the\"],"
                + "\"numberWords\":{\"one\":1,\"hundred\":100},"
                + "\"vocabulary\":{\"file\":3},"
                + "\"comment\":{\"nested\":[1,2,{\"x\":true}]},"
                + "\"version\":2}"));

        assertTrue(gazetteer.isStopword("the"));
        assertFalse(gazetteer.isStopword("file"));
        assertEquals(Optional.of("1"), gazetteer.numberFor("one"));
        assertEquals(Optional.of("100"), gazetteer.numberFor("hundred"));
        assertEquals(Optional.empty(), gazetteer.numberFor("file"));
        assertEquals(Integer.valueOf(3), gazetteer.vocabulary().get("file"));
    }

    @Test
    public void testMissingSectionsAreEmpty() throws IOException {
        Gazetteer gazetteer = loader.load(json("{\"stopwords\":[\"a\"]}"));
        assertTrue(gazetteer.numberWords().isEmpty());
        assertTrue(gazetteer.vocabulary().isEmpty());
    }

    @Test
    public void testRejectsNonObject() {
        assertThrows(IOException.class, () -> loader.load(json("[\"a\"]")));
    }

    @Test
    public void testRejectsNonIntegerCount() {
        assertThrows(IOException.class, () -> loader.load(json("{\"numberWords\":{\"one\":\"1\"}}")));
    }

    @Test
    public void testRejectsNonStringStopword() {
        assertThrows(IOException.class, () -> loader.load(json("{\"stopwords\":[1]}")));
    }

    @Test
    public void testLoadDefault() {
        Gazetteer gazetteer = loader.loadDefault();

        assertTrue(gazetteer.isStopword("the"));
        assertTrue(gazetteer.isStopword("want"));
        assertEquals(Optional.of("3"), gazetteer.numberFor("three"));
        assertTrue(gazetteer.vocabulary().containsKey("file"));
    }
}
