package com.redditads.catalog;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the {@code type} keyword of a JSON Schema node, which may be a string or a list of strings.
 */
public final class JsonSchemaTypes {

    private JsonSchemaTypes() {
    }

    public static List<String> of(JsonNode schema) {
        JsonNode type = schema.path("type");
        List<String> types = new ArrayList<>();
        if (type.isTextual()) {
            types.add(type.asText());
        } else if (type.isArray()) {
            type.forEach(t -> types.add(t.asText()));
        }
        return types;
    }

    public static boolean allows(JsonNode schema, String type) {
        return of(schema).contains(type);
    }
}
