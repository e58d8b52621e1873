package com.github.dimitryivaniuta.edgeguard.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.edgeguard.web.EdgeApiException;
import com.github.dimitryivaniuta.edgeguard.web.JsonBodies;

public record AnalyzeRequest(String prompt, String systemInstruction) {

    public static final String MISSING_FIELDS = "Bad Request: Missing prompt or systemInstruction";

    /**
     * Both fields must be non-blank strings; anything else is a 400.
     */
    public static AnalyzeRequest from(JsonNode body) {
        String prompt = JsonBodies.text(body, "prompt");
        String systemInstruction = JsonBodies.text(body, "systemInstruction");
        if (prompt == null || systemInstruction == null) {
            throw EdgeApiException.badRequest(MISSING_FIELDS);
        }
        return new AnalyzeRequest(prompt, systemInstruction);
    }
}
