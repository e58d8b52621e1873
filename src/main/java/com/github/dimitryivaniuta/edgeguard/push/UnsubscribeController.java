package com.github.dimitryivaniuta.edgeguard.push;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import com.github.dimitryivaniuta.edgeguard.web.BoundedBodyReader;
import com.github.dimitryivaniuta.edgeguard.web.EdgeApiException;
import com.github.dimitryivaniuta.edgeguard.web.EndpointRateLimitGuard;
import com.github.dimitryivaniuta.edgeguard.web.JsonBodies;
import com.github.dimitryivaniuta.edgeguard.web.SyncKeyHeader;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class UnsubscribeController {

    static final String NAMESPACE = "unsubscribe";
    static final String MISSING_ENDPOINT = "Bad Request: Missing endpoint in request body";

    private final PushSubscriptionService pushSubscriptionService;
    private final EndpointRateLimitGuard rateLimitGuard;
    private final BoundedBodyReader bodyReader;
    private final EdgeProtectionProperties properties;
    private final ObjectMapper objectMapper;

    @PostMapping(value = "/unsubscribe", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> unsubscribe(HttpServletRequest request) {
        EdgeProtectionProperties.Unsubscribe cfg = properties.getUnsubscribe();
        rateLimitGuard.enforce(NAMESPACE, request, cfg.getRateLimit());
        String keyHash = SyncKeyHeader.require(request);

        byte[] body = bodyReader.read(request, cfg.getMaxBodySize(), cfg.getBodyReadTimeout());
        JsonNode json = JsonBodies.readObject(objectMapper, body);
        // deletion is by key hash; the endpoint only confirms the client knows which subscription it drops
        if (JsonBodies.text(json, "endpoint") == null) {
            throw EdgeApiException.badRequest(MISSING_ENDPOINT);
        }

        pushSubscriptionService.unsubscribe(keyHash);
        return ResponseEntity.ok("{\"success\":true}");
    }
}
