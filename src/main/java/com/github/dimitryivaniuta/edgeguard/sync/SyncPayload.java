package com.github.dimitryivaniuta.edgeguard.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.edgeguard.web.EdgeApiException;

import java.math.BigDecimal;

/**
 * Client sync document. {@code state} is opaque ciphertext; only {@code lastModified} is interpreted.
 *
 * @param document the full object as sent, stored verbatim
 */
public record SyncPayload(BigDecimal lastModified, String state, ObjectNode document) {

    public static final String INVALID_PAYLOAD = "Bad Request: Invalid or missing payload data";

    public static SyncPayload from(JsonNode body) {
        JsonNode lastModified = body.get("lastModified");
        JsonNode state = body.get("state");
        if (lastModified == null || !lastModified.isNumber() || state == null || !state.isTextual()) {
            throw EdgeApiException.badRequest(INVALID_PAYLOAD);
        }
        return new SyncPayload(lastModified.decimalValue(), state.textValue(), (ObjectNode) body);
    }
}
