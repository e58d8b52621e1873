package com.github.dimitryivaniuta.edgeguard.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Gemini {@code generateContent} client.
 *
 * <p>Provider errors are surfaced as {@link UpstreamException} with the HTTP status and the
 * {@code error.status} field of the provider's error body, so quota classification does not depend
 * on message text when the provider is explicit.
 */
@Slf4j
public class GeminiLlmProvider implements LlmProvider {

    static final String API_KEY_HEADER = "x-goog-api-key";

    private final RestClient restClient;
    private final String apiKey;
    private final ObjectMapper objectMapper;

    public GeminiLlmProvider(RestClient restClient, String apiKey, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isConfigured() {
        return !apiKey.isEmpty();
    }

    @Override
    public String generate(GenerationRequest request) {
        if (!isConfigured()) {
            throw new IllegalStateException("LLM provider API key is not configured");
        }

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", request.contents())))),
                "systemInstruction", Map.of(
                        "parts", List.of(Map.of("text", request.systemInstruction())))
        );

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1beta/models/{model}:generateContent", request.model())
                    .header(API_KEY_HEADER, apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            throw toUpstreamException(ex);
        } catch (ResourceAccessException ex) {
            // connect / read timeouts land here; the classifier looks at the cause chain
            throw new UpstreamException("Upstream I/O failure: " + ex.getMessage(), ex);
        }

        return extractText(response);
    }

    // ---- Response parsing ----

    static String extractText(JsonNode response) {
        if (response == null) {
            throw new UpstreamException(0, null, "Empty response from provider");
        }
        JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            String finishReason = response.path("candidates").path(0).path("finishReason").asText("");
            throw new UpstreamException(0, null, "Provider returned no content"
                    + (finishReason.isEmpty() ? "" : " (finishReason=" + finishReason + ")"));
        }

        StringBuilder sb = new StringBuilder();
        for (JsonNode part : parts) {
            JsonNode text = part.get("text");
            if (text != null && text.isTextual()) {
                sb.append(text.textValue());
            }
        }
        return sb.toString();
    }

    private UpstreamException toUpstreamException(RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        String providerStatus = null;
        String message = ex.getStatusText();

        String raw = ex.getResponseBodyAsString();
        if (raw != null && !raw.isBlank()) {
            try {
                JsonNode error = objectMapper.readTree(raw).path("error");
                if (error.hasNonNull("status")) providerStatus = error.get("status").asText();
                if (error.hasNonNull("message")) message = error.get("message").asText();
            } catch (IOException parseFailure) {
                log.debug("Provider error body is not JSON (status={})", status);
                message = raw;
            }
        }

        log.warn("Provider call failed: status={} providerStatus={}", status, providerStatus);
        return new UpstreamException(status, providerStatus, message);
    }
}
