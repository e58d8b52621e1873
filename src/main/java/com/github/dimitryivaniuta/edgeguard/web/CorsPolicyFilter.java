package com.github.dimitryivaniuta.edgeguard.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import com.github.dimitryivaniuta.edgeguard.protection.metrics.EdgeProtectionMetrics;
import com.github.dimitryivaniuta.edgeguard.protection.origin.OriginRule;
import com.github.dimitryivaniuta.edgeguard.protection.origin.OriginRules;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * CORS policy for {@code /api/**}.
 *
 * <ul>
 *   <li>Allow-Origin is the reflected request origin when allowed, else {@code "null"}; always with
 *       {@code Vary: Origin}.</li>
 *   <li>Strict mode: a present Origin that matches no rule gets 403. Requests without Origin pass.</li>
 *   <li>Preflight ({@code OPTIONS}) is answered with 204 here and never reaches a controller.</li>
 * </ul>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class CorsPolicyFilter extends OncePerRequestFilter {

    static final String API_PREFIX = "/api/";

    private final EdgeProtectionProperties.Cors cors;
    private final List<OriginRule> rules;
    private final EdgeProtectionMetrics metrics;
    private final ObjectMapper objectMapper;

    public CorsPolicyFilter(EdgeProtectionProperties properties,
                            EdgeProtectionMetrics metrics,
                            ObjectMapper objectMapper) {
        this.cors = properties.getCors();
        this.rules = OriginRules.parseAllowedOrigins(cors.getAllowedOrigins());
        this.metrics = metrics;
        this.objectMapper = objectMapper;

        long invalid = rules.stream().filter(r -> r.kind() == OriginRule.Kind.INVALID).count();
        if (invalid > 0) {
            log.warn("{} allowed-origin rule(s) are invalid and will never match", invalid);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, OriginRules.getCorsOrigin(request, rules));
        response.addHeader(HttpHeaders.VARY, HttpHeaders.ORIGIN);
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, cors.getAllowedMethods());
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, cors.getAllowedHeaders());
        response.setHeader(HttpHeaders.ACCESS_CONTROL_EXPOSE_HEADERS, cors.getExposedHeaders());
        response.setHeader(HttpHeaders.ACCESS_CONTROL_MAX_AGE, String.valueOf(cors.getMaxAgeSeconds()));

        String origin = request.getHeader(HttpHeaders.ORIGIN);
        if (cors.isStrict() && origin != null && !origin.isBlank()
                && !OriginRules.isOriginAllowed(request, origin, rules)) {
            metrics.corsRejected();
            log.info("Rejected request from disallowed origin on {}", request.getRequestURI());
            writeForbidden(response);
            return;
        }

        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            response.setStatus(HttpStatus.NO_CONTENT.value());
            return;
        }

        chain.doFilter(request, response);
    }

    private void writeForbidden(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(),
                new GlobalExceptionHandler.ApiError("Forbidden", "Origin not allowed"));
    }
}
