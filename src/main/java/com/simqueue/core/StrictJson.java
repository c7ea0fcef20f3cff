package com.simqueue.core;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;

/**
 * RFC 8259 JSON parsing. {@code JsonParser} always reads leniently and accepts unquoted
 * names, single quotes, bare words and trailing commas; this reader does not.
 */
public final class StrictJson {
    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = new Gson().getAdapter(JsonElement.class);

    private StrictJson() {
    }

    /**
     * @param text JSON text
     * @return the parsed value
     * @throws JsonParseException if the text is not exactly one well-formed JSON value
     */
    public static JsonElement parse(String text) {
        try (JsonReader reader = new JsonReader(new StringReader(text))) {
            reader.setLenient(false);
            JsonElement element = ELEMENT_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonSyntaxException("trailing data after JSON value");
            }
            return element;
        } catch (IOException | IllegalStateException | NumberFormatException e) {
            throw new JsonSyntaxException(e.getMessage(), e);
        }
    }
}
