package com.astpath.json;

import com.astpath.tree.SimpleNode;
import com.astpath.tree.Span;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a syntax tree that a front end serialized as JSON:
 *
 * <pre>
 * {
 *   "kind": "method", "name": "GetUser", "kinds": ["member"],
 *   "text": "public async Task GetUser() { ... }",
 *   "span": {"startLine": 3, "startColumn": 5, "endLine": 9, "endColumn": 6},
 *   "attributes": {"async": true, "modifiers": "public async", "parameters": 0},
 *   "children": [ ... ]
 * }
 * </pre>
 *
 * Only {@code kind} is required. Unknown fields are skipped.
 */
public class JsonTreeReader {
    private final JsonFactory factory = new JsonFactory();

    public SimpleNode read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Expected a node object but found " + token);
            }
            return readNode(parser).build();
        }
    }

    private SimpleNode.Builder readNode(JsonParser parser) throws IOException {
        String kind = null;
        String name = null;
        String text = null;
        String[] extraKinds = new String[0];
        Span span = Span.NONE;
        SimpleNode.Builder[] children = new SimpleNode.Builder[0];
        MutableMap<String, Object> attributes = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String field = parser.currentName();
            JsonToken value = parser.nextToken();
            switch (field) {
                case "kind" -> kind = readString(parser, field);
                case "name" -> name = value == JsonToken.VALUE_NULL ? null : readString(parser, field);
                case "text" -> text = readString(parser, field);
                case "kinds" -> extraKinds = readStrings(parser);
                case "span" -> span = readSpan(parser);
                case "attributes" -> readAttributes(parser, attributes);
                case "children" -> children = readChildren(parser);
                default -> parser.skipChildren();
            }
        }

        if (kind == null) {
            throw new IOException("Node without \"kind\" at " + parser.currentLocation());
        }
        SimpleNode.Builder builder = SimpleNode.builder(kind).name(name).text(text).span(span).alsoKind(extraKinds);
        attributes.forEachKeyValue(builder::attribute);
        return builder.children(children);
    }

    private SimpleNode.Builder[] readChildren(JsonParser parser) throws IOException {
        expect(parser, JsonToken.START_ARRAY, "children");
        var children = Lists.mutable.<SimpleNode.Builder>empty();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            expect(parser, JsonToken.START_OBJECT, "child node");
            children.add(readNode(parser));
        }
        return children.toArray(new SimpleNode.Builder[0]);
    }

    private void readAttributes(JsonParser parser, MutableMap<String, Object> attributes) throws IOException {
        expect(parser, JsonToken.START_OBJECT, "attributes");
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String key = parser.currentName();
            JsonToken token = parser.nextToken();
            switch (token) {
                case VALUE_TRUE -> attributes.put(key, true);
                case VALUE_FALSE -> attributes.put(key, false);
                case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> attributes.put(key, parser.getDoubleValue());
                case VALUE_STRING -> attributes.put(key, parser.getText());
                case VALUE_NULL -> { }
                default -> throw new IOException("Unsupported value for attribute \"" + key + "\": " + token);
            }
        }
    }

    private Span readSpan(JsonParser parser) throws IOException {
        expect(parser, JsonToken.START_OBJECT, "span");
        int startLine = 0;
        int startColumn = 0;
        int endLine = 0;
        int endColumn = 0;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String field = parser.currentName();
            parser.nextToken();
            switch (field) {
                case "startLine" -> startLine = parser.getIntValue();
                case "startColumn" -> startColumn = parser.getIntValue();
                case "endLine" -> endLine = parser.getIntValue();
                case "endColumn" -> endColumn = parser.getIntValue();
                default -> parser.skipChildren();
            }
        }
        return Span.of(startLine, startColumn, endLine, endColumn);
    }

    private String[] readStrings(JsonParser parser) throws IOException {
        expect(parser, JsonToken.START_ARRAY, "kinds");
        var values = Lists.mutable.<String>empty();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            values.add(readString(parser, "kinds"));
        }
        return values.toArray(new String[0]);
    }

    private String readString(JsonParser parser, String field) throws IOException {
        if (parser.currentToken() != JsonToken.VALUE_STRING) {
            throw new IOException("Expected a string for \"" + field + "\" but found " + parser.currentToken());
        }
        return parser.getText();
    }

    private void expect(JsonParser parser, JsonToken expected, String what) throws IOException {
        if (parser.currentToken() != expected) {
            throw new IOException("Expected " + expected + " for " + what + " but found " + parser.currentToken());
        }
    }
}
