package com.nlbash.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Formats token sequences for display, either space separated or as a compact JSON array.
 */
public class SequenceFormatter {
    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private final boolean json;

    public SequenceFormatter(boolean json) {
        this.json = json;
    }

    public String format(List<String> tokens) {
        if (!json) {
            return String.join(" ", tokens);
        }

        StringWriter out = new StringWriter(tokens.size() * 8 + 2);
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(out)) {
            generator.writeStartArray();
            for (String token : tokens) {
                generator.writeString(token);
            }
            generator.writeEndArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
