package com.github.dimitryivaniuta.edgeguard.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Request failure with a fixed status and a client-safe envelope ({@code error}, {@code details}).
 *
 * <p>Throttling is not modelled here; see {@code RateLimitExceededException}.
 */
@Getter
public class EdgeApiException extends RuntimeException {

    private final HttpStatus status;
    private final String details;

    public EdgeApiException(HttpStatus status, String error, String details) {
        super(error);
        this.status = status;
        this.details = details;
    }

    // ---- client errors ----
    public static EdgeApiException badRequest(String error) {
        return new EdgeApiException(HttpStatus.BAD_REQUEST, error, null);
    }

    public static EdgeApiException unauthorized(String error) {
        return new EdgeApiException(HttpStatus.UNAUTHORIZED, error, null);
    }

    public static EdgeApiException payloadTooLarge(long maxBytes) {
        return new EdgeApiException(HttpStatus.PAYLOAD_TOO_LARGE, "Payload Too Large",
                "Payload size exceeds the limit of " + maxBytes + " bytes.");
    }

    // ---- timeouts ----
    public static EdgeApiException requestTimeout() {
        return new EdgeApiException(HttpStatus.REQUEST_TIMEOUT, "Request Timeout",
                "Request body was not received in time.");
    }

    public static EdgeApiException gatewayTimeout() {
        return new EdgeApiException(HttpStatus.GATEWAY_TIMEOUT, "Gateway Timeout",
                "Upstream provider did not answer in time.");
    }

    // ---- server side ----
    public static EdgeApiException internal(String details) {
        return new EdgeApiException(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", details);
    }

    public static EdgeApiException serviceUnavailable() {
        return new EdgeApiException(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "Server is busy. Try again later.");
    }
}
