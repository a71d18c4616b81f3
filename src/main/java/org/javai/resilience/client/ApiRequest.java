package org.javai.resilience.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An API call described relative to the client's base URL.
 *
 * <p>Instances are immutable; {@link #query(String, String)} and
 * {@link #header(String, String)} return copies.</p>
 */
public final class ApiRequest {

    private final String method;
    private final String path;
    private final Map<String, String> query;
    private final Map<String, String> headers;
    private final RequestBody body;

    private ApiRequest(String method, String path, Map<String, String> query, Map<String, String> headers, RequestBody body) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
    }

    public static ApiRequest of(String method, String path) {
        return new ApiRequest(method, path, Map.of(), Map.of(), null);
    }

    public static ApiRequest get(String path) {
        return of("GET", path);
    }

    public static ApiRequest delete(String path) {
        return of("DELETE", path);
    }

    public static ApiRequest post(String path, RequestBody body) {
        return of("POST", path).body(body);
    }

    public static ApiRequest put(String path, RequestBody body) {
        return of("PUT", path).body(body);
    }

    public static ApiRequest patch(String path, RequestBody body) {
        return of("PATCH", path).body(body);
    }

    public ApiRequest query(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(query);
        copy.put(Objects.requireNonNull(name, "name must not be null"), Objects.requireNonNull(value, "value must not be null"));
        return new ApiRequest(method, path, copy, headers, body);
    }

    public ApiRequest query(Map<String, String> parameters) {
        Map<String, String> copy = new LinkedHashMap<>(query);
        copy.putAll(parameters);
        return new ApiRequest(method, path, copy, headers, body);
    }

    public ApiRequest header(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(Objects.requireNonNull(name, "name must not be null"), Objects.requireNonNull(value, "value must not be null"));
        return new ApiRequest(method, path, query, copy, body);
    }

    public ApiRequest body(RequestBody body) {
        return new ApiRequest(method, path, query, headers, body);
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public Map<String, String> query() {
        return query;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public RequestBody body() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * Operation name used in reports, e.g. {@code GET /orders}.
     */
    public String operation() {
        return method + " " + path;
    }

    @Override
    public String toString() {
        return operation();
    }
}
