package com.nlbash.gazetteer;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Reads a {@link Gazetteer} from JSON of the form
 * {@code {"stopwords": [...], "numberWords": {"one": 1}, "vocabulary": {"file": 120}}}.
 * Unknown fields are skipped.
 */
public class GazetteerLoader {
    private static final Logger logger = LoggerFactory.getLogger(GazetteerLoader.class);

    public static final String DEFAULT_RESOURCE = "/gazetteer.json";

    private final JsonFactory factory = new JsonFactory();

    public Gazetteer loadDefault() {
        try (InputStream input = GazetteerLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new FileNotFoundException("Classpath resource not found: " + DEFAULT_RESOURCE);
            }
            return load(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load " + DEFAULT_RESOURCE, e);
        }
    }

    public Gazetteer load(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Expected a gazetteer object but got: " + token);
            }

            MutableSet<String> stopwords = Sets.mutable.empty();
            MutableMap<String, Long> numberWords = Maps.mutable.empty();
            MutableMap<String, Integer> vocabulary = Maps.mutable.empty();

            while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
                if (token == null) {
                    throw new IOException("Unexpected end of gazetteer input");
                }
                String fieldName = parser.currentName();
                parser.nextToken();
                switch (fieldName) {
                    case "stopwords" -> parseWords(parser, stopwords);
                    case "numberWords" -> parseCounts(parser, (word, n) -> numberWords.put(word, n));
                    case "vocabulary" -> parseCounts(parser, (word, n) -> vocabulary.put(word, (int) n));
                    default -> {
                        logger.debug("Skipping unknown gazetteer field '{}'", fieldName);
                        parser.skipChildren();
                    }
                }
            }

            logger.debug("Loaded gazetteer: {} stopwords, {} number words, {} vocabulary words",
                    stopwords.size(), numberWords.size(), vocabulary.size());
            return new Gazetteer(stopwords.toImmutable(), numberWords.toImmutable(), vocabulary.toImmutable());
        }
    }

    private void parseWords(JsonParser parser, MutableSet<String> words) throws IOException {
        expect(parser, JsonToken.START_ARRAY);
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token != JsonToken.VALUE_STRING) {
                throw new IOException("Expected a word but got: " + token);
            }
            words.add(parser.getText());
        }
    }

    private void parseCounts(JsonParser parser, CountConsumer consumer) throws IOException {
        expect(parser, JsonToken.START_OBJECT);
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
            if (token == null) {
                throw new IOException("Unexpected end of gazetteer input");
            }
            String word = parser.currentName();
            if (parser.nextToken() != JsonToken.VALUE_NUMBER_INT) {
                throw new IOException("Expected an integer for '" + word + "'");
            }
            consumer.accept(word, parser.getLongValue());
        }
    }

    private static void expect(JsonParser parser, JsonToken expected) throws IOException {
        if (parser.currentToken() != expected) {
            throw new IOException("Expected " + expected + " but got: " + parser.currentToken());
        }
    }

    @FunctionalInterface
    private interface CountConsumer {
        void accept(String word, long count);
    }
}
