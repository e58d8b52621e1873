package com.github.dimitryivaniuta.edgeguard.web;

import com.github.dimitryivaniuta.edgeguard.protection.EdgeProtectionProperties;
import com.github.dimitryivaniuta.edgeguard.protection.ip.ClientIpResolver;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter =
            new CorrelationIdFilter(new ClientIpResolver(new EdgeProtectionProperties.ClientIp()));

    private final Map<String, String> seenInChain = new HashMap<>();

    private MockHttpServletResponse run(MockHttpServletRequest request) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse res) {
                seenInChain.put("correlationId", MDC.get("correlationId"));
                seenInChain.put("clientIp", MDC.get("clientIp"));
            }
        });
        filter.doFilter(request, response, chain);
        return response;
    }

    @Test
    void clientIdAndResolvedIpAreInMdcDuringTheRequestOnly() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/analyze");
        request.addHeader("X-Correlation-Id", "req-42");
        request.addHeader("X-Forwarded-For", "198.51.100.1, 203.0.113.9");

        MockHttpServletResponse response = run(request);

        assertThat(response.getHeader("X-Correlation-Id")).isEqualTo("req-42");
        assertThat(seenInChain).containsEntry("correlationId", "req-42").containsEntry("clientIp", "203.0.113.9");
        assertThat(MDC.get("correlationId")).isNull();
        assertThat(MDC.get("clientIp")).isNull();
    }

    @Test
    void platformRequestIdIsUsedWhenClientSendsNone() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sync");
        request.addHeader("X-Vercel-Id", "fra1::abcd-1700000000000-0123456789ab");

        assertThat(run(request).getHeader("X-Correlation-Id")).isEqualTo("fra1::abcd-1700000000000-0123456789ab");
        assertThat(seenInChain).containsEntry("clientIp", ClientIpResolver.UNKNOWN);
    }

    @Test
    void unsafeIdsFallBackToFreshUuid() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sync");
        request.addHeader("X-Correlation-Id", "bad id\r\nSet-Cookie: x");
        request.addHeader("X-Vercel-Id", "x".repeat(65));

        String id = run(request).getHeader("X-Correlation-Id");

        assertThat(id).matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
        assertThat(seenInChain).containsEntry("correlationId", id);
    }
}
