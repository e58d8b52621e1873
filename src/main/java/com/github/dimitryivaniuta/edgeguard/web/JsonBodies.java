package com.github.dimitryivaniuta.edgeguard.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

public final class JsonBodies {

    public static final String INVALID_JSON = "Bad Request: Invalid JSON format";

    private JsonBodies() {
    }

    /**
     * Parses a request body that must be a JSON object; anything else is a 400.
     */
    public static JsonNode readObject(ObjectMapper mapper, byte[] body) {
        if (body == null || body.length == 0) {
            throw EdgeApiException.badRequest(INVALID_JSON);
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw EdgeApiException.badRequest(INVALID_JSON);
            }
            return node;
        } catch (IOException ex) {
            throw EdgeApiException.badRequest(INVALID_JSON);
        }
    }

    /**
     * Non-blank string field or {@code null}. Numbers, booleans and objects do not count as text.
     */
    public static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) return null;
        String s = v.textValue();
        return s.isBlank() ? null : s;
    }
}
