package com.github.dimitryivaniuta.edgeguard.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import com.github.dimitryivaniuta.edgeguard.web.BoundedBodyReader;
import com.github.dimitryivaniuta.edgeguard.web.EndpointRateLimitGuard;
import com.github.dimitryivaniuta.edgeguard.web.JsonBodies;
import com.github.dimitryivaniuta.edgeguard.web.RequestContextKeys;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * {@code POST /api/analyze}: rate limit, bounded body, validation, then {@link AnalysisService}.
 * CORS and preflight are handled by the filter in front of it.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalyzeController {

    static final String NAMESPACE = "analyze";

    private final AnalysisService analysisService;
    private final EndpointRateLimitGuard rateLimitGuard;
    private final BoundedBodyReader bodyReader;
    private final EdgeProtectionProperties properties;
    private final ObjectMapper objectMapper;

    @PostMapping("/analyze")
    public ResponseEntity<String> analyze(HttpServletRequest request) {
        EdgeProtectionProperties.Analyze cfg = properties.getAnalyze();

        rateLimitGuard.enforce(NAMESPACE, request, cfg.getRateLimit());

        byte[] body = bodyReader.read(request, cfg.getMaxBodySize(), cfg.getBodyReadTimeout());
        AnalyzeRequest analyzeRequest = AnalyzeRequest.from(JsonBodies.readObject(objectMapper, body));

        AnalysisResult result = analysisService.analyze(analyzeRequest);
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .header(RequestContextKeys.CACHE_STATUS_HEADER, result.cacheStatus())
                .body(result.text());
    }
}
