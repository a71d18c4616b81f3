package org.javai.resilience.boundary;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * A fully resolved request as handed to a {@link Transport}.
 *
 * @param method HTTP method
 * @param uri absolute target URI
 * @param headers request headers
 * @param body request body bytes, or null for no body
 * @param timeout per-request timeout
 * @param replayable whether the body may be sent more than once
 */
public record TransportRequest(
        String method,
        URI uri,
        Map<String, String> headers,
        byte[] body,
        Duration timeout,
        boolean replayable
) {

    public TransportRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public TransportRequest(String method, URI uri, Map<String, String> headers, byte[] body, Duration timeout) {
        this(method, uri, headers, body, timeout, true);
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
