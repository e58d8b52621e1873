package com.github.dimitryivaniuta.edgeguard.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import com.github.dimitryivaniuta.edgeguard.web.BoundedBodyReader;
import com.github.dimitryivaniuta.edgeguard.web.EdgeApiException;
import com.github.dimitryivaniuta.edgeguard.web.EndpointRateLimitGuard;
import com.github.dimitryivaniuta.edgeguard.web.JsonBodies;
import com.github.dimitryivaniuta.edgeguard.web.SyncKeyHeader;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SyncController {

    static final String NAMESPACE = "sync";
    static final String SUCCESS_JSON = "{\"success\":true}";

    private final SyncService syncService;
    private final EndpointRateLimitGuard rateLimitGuard;
    private final BoundedBodyReader bodyReader;
    private final EdgeProtectionProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Stored document, or JSON {@code null} when the client has never synced.
     */
    @GetMapping(value = "/sync", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> load(HttpServletRequest request) {
        rateLimitGuard.enforce(NAMESPACE, request, properties.getSync().getRateLimit());
        String keyHash = SyncKeyHeader.require(request);

        return ResponseEntity.ok(syncService.load(keyHash).orElse("null"));
    }

    @PostMapping(value = "/sync", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> save(HttpServletRequest request) {
        EdgeProtectionProperties.Sync cfg = properties.getSync();
        rateLimitGuard.enforce(NAMESPACE, request, cfg.getRateLimit());
        String keyHash = SyncKeyHeader.require(request);

        byte[] body = bodyReader.read(request, cfg.getMaxBodySize(), cfg.getBodyReadTimeout());
        SyncPayload payload = SyncPayload.from(JsonBodies.readObject(objectMapper, body));
        if (payload.state().length() > cfg.getMaxBodySize().toBytes()) {
            throw EdgeApiException.payloadTooLarge(cfg.getMaxBodySize().toBytes());
        }

        SyncOutcome outcome = syncService.save(keyHash, payload);
        return switch (outcome.status()) {
            case STORED -> ResponseEntity.ok(SUCCESS_JSON);
            case NOT_MODIFIED -> ResponseEntity.status(HttpStatus.NOT_MODIFIED).build();
            case CONFLICT -> ResponseEntity.status(HttpStatus.CONFLICT).body(outcome.storedDocument());
        };
    }
}
