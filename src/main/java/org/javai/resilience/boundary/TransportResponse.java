package org.javai.resilience.boundary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A completed HTTP exchange with its body fully read.
 *
 * @param statusCode HTTP status code
 * @param headers response headers
 * @param body response body as text (empty when there is none)
 */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, String body) {

    public TransportResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, Map.of(), body);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Returns the first value of a header, matching its name case-insensitively.
     */
    public Optional<String> header(String name) {
        Objects.requireNonNull(name, "name must not be null");
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return Optional.ofNullable(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy of this response with one more header.
     */
    public TransportResponse withHeader(String name, String value) {
        Map<String, List<String>> copy = new LinkedHashMap<>(headers);
        copy.put(name, List.of(value));
        return new TransportResponse(statusCode, copy, body);
    }
}
