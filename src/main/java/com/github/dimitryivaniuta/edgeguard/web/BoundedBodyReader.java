package com.github.dimitryivaniuta.edgeguard.web;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.unit.DataSize;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads request bodies with a byte cap and a wall-clock deadline, before any parsing happens.
 *
 * <ul>
 *   <li>declared Content-Length above the cap: 413 without reading</li>
 *   <li>more bytes than the cap actually arrive: 413</li>
 *   <li>body not complete within the deadline: 408, the read task is cancelled</li>
 *   <li>no free reader in the bounded pool: 503</li>
 * </ul>
 */
@Slf4j
public class BoundedBodyReader {

    private static final int BUFFER_SIZE = 8192;

    private final ExecutorService executor;

    public BoundedBodyReader(ExecutorService executor) {
        this.executor = executor;
    }

    public byte[] read(HttpServletRequest request, DataSize maxSize, Duration timeout) {
        return read(() -> request.getInputStream(), request.getContentLengthLong(), maxSize.toBytes(), timeout);
    }

    public byte[] read(BodySource source, long declaredLength, long maxBytes, Duration timeout) {
        if (declaredLength > maxBytes) {
            throw EdgeApiException.payloadTooLarge(maxBytes);
        }

        Future<byte[]> pending;
        try {
            pending = executor.submit(() -> {
                try (InputStream in = source.open()) {
                    return readCapped(in, maxBytes);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn("Body-read pool saturated; rejecting request");
            throw EdgeApiException.serviceUnavailable();
        }

        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            pending.cancel(true);
            throw EdgeApiException.requestTimeout();
        } catch (InterruptedException ex) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw EdgeApiException.requestTimeout();
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof EdgeApiException api) {
                throw api;
            }
            log.warn("Failed to read request body: {}", ex.getCause() == null ? ex.toString() : ex.getCause().toString());
            throw EdgeApiException.badRequest("Bad Request: Unreadable request body");
        }
    }

    private static byte[] readCapped(InputStream in, long maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(maxBytes, BUFFER_SIZE));
        byte[] buf = new byte[BUFFER_SIZE];
        long total = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            total += n;
            if (total > maxBytes) {
                throw EdgeApiException.payloadTooLarge(maxBytes);
            }
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    @FunctionalInterface
    public interface BodySource {
        InputStream open() throws IOException;
    }
}
