package com.github.dimitryivaniuta.edgeguard.web;

import com.github.dimitryivaniuta.edgeguard.protection.ip.ClientIpResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a correlation id and the resolved client IP, both in the MDC for log lines
 * and the id also in the response header.
 *
 * <p>Id source, first usable wins: client {@code X-Correlation-Id}, the hosting platform's request id,
 * a fresh UUID. Values that do not look like an id are ignored since they end up in logs and headers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9._:-]{1,64}$");

    private final ClientIpResolver clientIpResolver;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String corr = firstSafe(
                request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER),
                request.getHeader(RequestContextKeys.PLATFORM_REQUEST_ID_HEADER));
        if (corr == null) corr = UUID.randomUUID().toString();

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        MDC.put(RequestContextKeys.CLIENT_IP_MDC_KEY, clientIpResolver.getClientIp(request));
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
            MDC.remove(RequestContextKeys.CLIENT_IP_MDC_KEY);
        }
    }

    private static String firstSafe(String... candidates) {
        for (String c : candidates) {
            if (c != null && SAFE_ID.matcher(c).matches()) return c;
        }
        return null;
    }
}
