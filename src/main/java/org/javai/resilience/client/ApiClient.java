package org.javai.resilience.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.resilience.ApiError;
import org.javai.resilience.Outcome;
import org.javai.resilience.boundary.HttpErrorClassifier;
import org.javai.resilience.boundary.JdkHttpTransport;
import org.javai.resilience.boundary.ResponseDecoder;
import org.javai.resilience.boundary.Transport;
import org.javai.resilience.boundary.TransportRequest;
import org.javai.resilience.guard.CircuitBreaker;
import org.javai.resilience.guard.RateLimiter;
import org.javai.resilience.ops.OpReporter;
import org.javai.resilience.retry.RequestExecutor;
import org.javai.resilience.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

/**
 * Entry point for calling a JSON/HTTP API.
 *
 * <p>Every call goes through one shared {@link RequestExecutor}, so the circuit breaker,
 * the rate limiter and the connection slots are shared by all calls of a client and of the
 * clients derived from it with {@link #authenticate(String)}.</p>
 *
 * <pre>{@code
 * ApiClient client = ApiClient.create(ClientConfig.builder("https://api.example.com/v1")
 *         .circuitBreaker(5, Duration.ofSeconds(30))
 *         .build())
 *     .authenticate("Bearer " + token);
 *
 * Outcome<Order> order = client.get("/orders/42", Order.class);
 * client.stream("/orders", Map.of("status", "open"), Order.class)
 *     .stream()
 *     .forEach(item -> ...);
 * }</pre>
 */
public final class ApiClient {

    private static final Logger log = LoggerFactory.getLogger(ApiClient.class);

    static final String ACCEPT = "Accept";
    static final String CONTENT_TYPE = "Content-Type";
    static final String USER_AGENT = "User-Agent";
    static final String AUTHORIZATION = "Authorization";
    static final String CLIENT_VERSION = "X-Client-Version";
    static final String APPLICATION_JSON = "application/json";
    static final String COUNT_ONLY = "count_only";

    private final ClientConfig config;
    private final RequestExecutor executor;
    private final ObjectMapper mapper;
    private final RequestIds requestIds;
    private final String authorization;

    private ApiClient(ClientConfig config, RequestExecutor executor, ObjectMapper mapper, RequestIds requestIds, String authorization) {
        this.config = config;
        this.executor = executor;
        this.mapper = mapper;
        this.requestIds = requestIds;
        this.authorization = authorization;
    }

    /**
     * Creates a client over a {@link JdkHttpTransport} sized from the config's pool settings.
     */
    public static ApiClient create(ClientConfig config) {
        return builder(config).build();
    }

    public static Builder builder(ClientConfig config) {
        return new Builder(config);
    }

    /**
     * Builder for an {@link ApiClient}; every setting other than the config is optional.
     */
    public static final class Builder {
        private final ClientConfig config;
        private Transport transport;
        private OpReporter reporter = OpReporter.noOp();
        private ObjectMapper mapper;
        private Sleeper sleeper = Sleeper.nonBlocking();
        private LongSupplier nanoTimeSource = System::nanoTime;

        private Builder(ClientConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
        }

        public Builder transport(Transport transport) {
            this.transport = Objects.requireNonNull(transport, "transport must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Clock shared by the breaker, the limiter and the executor.
         */
        public Builder nanoTimeSource(LongSupplier nanoTimeSource) {
            this.nanoTimeSource = Objects.requireNonNull(nanoTimeSource, "nanoTimeSource must not be null");
            return this;
        }

        public ApiClient build() {
            ObjectMapper effectiveMapper = mapper != null ? mapper : new ObjectMapper();
            Transport effectiveTransport = transport != null ? transport : JdkHttpTransport.create(
                    config.connectTimeout(),
                    config.poolSettings().maxConnectionsPerHost(),
                    config.poolSettings().maxTotalConnections(),
                    config.poolSettings().idleTimeout());

            RequestExecutor.Builder executor = RequestExecutor.builder()
                    .transport(effectiveTransport)
                    .policy(config.retryPolicy())
                    .classifier(new HttpErrorClassifier(effectiveMapper, config.timeout()))
                    .reporter(reporter)
                    .sleeper(sleeper)
                    .nanoTimeSource(nanoTimeSource);
            config.circuitBreaker().ifPresent(threshold -> executor.circuitBreaker(
                    new CircuitBreaker(config.baseUrl().getHost(), threshold, config.circuitBreakerRecovery(), nanoTimeSource)));
            config.rateLimit().ifPresent(requests -> executor.rateLimiter(
                    new RateLimiter(requests, config.rateLimitWindow(), nanoTimeSource)));

            return new ApiClient(config, executor.build(), effectiveMapper, new RequestIds(config.requestIdPrefix()), null);
        }
    }

    /**
     * Returns a client that sends {@code headerValue} as its {@code Authorization} header
     * and shares everything else with this one.
     *
     * @param headerValue complete header value, e.g. {@code "Bearer abc"}
     */
    public ApiClient authenticate(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            throw new IllegalArgumentException("Authorization header value must not be null or empty");
        }
        return new ApiClient(config, executor, mapper, requestIds, headerValue);
    }

    public boolean isAuthenticated() {
        return authorization != null;
    }

    // === JSON VERBS ===

    public <T> Outcome<T> get(String path, Class<T> type) {
        return join(getAsync(path, type));
    }

    public <T> Outcome<T> get(String path, Map<String, String> query, Class<T> type) {
        return join(sendAsync(ApiRequest.get(path).query(query), type));
    }

    public <T> CompletableFuture<Outcome<T>> getAsync(String path, Class<T> type) {
        return sendAsync(ApiRequest.get(path), type);
    }

    public <T> Outcome<T> post(String path, Object body, Class<T> type) {
        return join(postAsync(path, body, type));
    }

    public <T> CompletableFuture<Outcome<T>> postAsync(String path, Object body, Class<T> type) {
        return withJsonBody(ApiRequest.of("POST", path), body, type);
    }

    public <T> Outcome<T> put(String path, Object body, Class<T> type) {
        return join(putAsync(path, body, type));
    }

    public <T> CompletableFuture<Outcome<T>> putAsync(String path, Object body, Class<T> type) {
        return withJsonBody(ApiRequest.of("PUT", path), body, type);
    }

    public <T> Outcome<T> patch(String path, Object body, Class<T> type) {
        return join(patchAsync(path, body, type));
    }

    public <T> CompletableFuture<Outcome<T>> patchAsync(String path, Object body, Class<T> type) {
        return withJsonBody(ApiRequest.of("PATCH", path), body, type);
    }

    public <T> Outcome<T> delete(String path, Class<T> type) {
        return join(deleteAsync(path, type));
    }

    public <T> CompletableFuture<Outcome<T>> deleteAsync(String path, Class<T> type) {
        return sendAsync(ApiRequest.delete(path), type);
    }

    /**
     * Deletes a resource whose endpoint answers without a body.
     */
    public Outcome<Void> deleteNoContent(String path) {
        return join(deleteNoContentAsync(path));
    }

    public CompletableFuture<Outcome<Void>> deleteNoContentAsync(String path) {
        return sendAsync(ApiRequest.delete(path), ResponseDecoder.discarding());
    }

    // === GENERIC ===

    public <T> Outcome<T> send(ApiRequest request, Class<T> type) {
        return join(sendAsync(request, type));
    }

    public <T> CompletableFuture<Outcome<T>> sendAsync(ApiRequest request, Class<T> type) {
        return sendAsync(request, jsonDecoder(mapper.constructType(type)));
    }

    /**
     * Sends a request through the executor with a caller-supplied decoder.
     */
    public <T> CompletableFuture<Outcome<T>> sendAsync(ApiRequest request, ResponseDecoder<T> decoder) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(decoder, "decoder must not be null");

        TransportRequest transportRequest;
        try {
            transportRequest = toTransportRequest(request);
        } catch (IOException e) {
            return CompletableFuture.completedFuture(
                    Outcome.fail(ApiError.Network.permanent("Failed to read request body: " + e.getMessage())));
        }
        return executor.executeAsync(request.operation(), transportRequest, decoder);
    }

    // === PAGINATION ===

    public <T> PageStream<T> stream(String path, Class<T> itemType) {
        return stream(path, Map.of(), itemType);
    }

    /**
     * Lazily iterates every item of a paginated list endpoint.
     *
     * @param path the list endpoint
     * @param query query of the first page; later pages use the server's cursor as is
     * @param itemType type each element of {@code data} is decoded to
     */
    public <T> PageStream<T> stream(String path, Map<String, String> query, Class<T> itemType) {
        String first = withQuery(resolve(path).toString(), query);
        JavaType pageType = mapper.constructType(JsonNode.class);
        return new PageStream<>(first,
                target -> join(sendAsync(ApiRequest.get(target), jsonDecoder(pageType))),
                mapper,
                mapper.constructType(itemType));
    }

    /**
     * Counts the items of a list endpoint with a single {@code count_only} request.
     */
    public Outcome<Long> count(String path, Map<String, String> query) {
        return join(countAsync(path, query));
    }

    public CompletableFuture<Outcome<Long>> countAsync(String path, Map<String, String> query) {
        Map<String, String> countQuery = new LinkedHashMap<>(query);
        countQuery.put(COUNT_ONLY, "true");
        return sendAsync(ApiRequest.get(path).query(countQuery), response -> {
            JsonNode json = mapper.readTree(response.body());
            JsonNode count = json == null ? null : json.has("count") ? json.get("count") : json.get("total_count");
            if (count == null || !count.canConvertToLong()) {
                throw new IOException("Count response has neither count nor total_count");
            }
            return count.asLong();
        });
    }

    public ClientConfig config() {
        return config;
    }

    public RequestExecutor executor() {
        return executor;
    }

    // === INTERNALS ===

    private <T> CompletableFuture<Outcome<T>> withJsonBody(ApiRequest request, Object body, Class<T> type) {
        if (body instanceof RequestBody) {
            return sendAsync(request.body((RequestBody) body), type);
        }
        try {
            return sendAsync(request.body(RequestBody.json(mapper.writeValueAsBytes(body))), type);
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(Outcome.fail(
                    new ApiError.InvalidRequest("Failed to serialize request body: " + e.getOriginalMessage())));
        }
    }

    private <T> ResponseDecoder<T> jsonDecoder(JavaType type) {
        return response -> {
            if (type.getRawClass() == Void.class) {
                return null;
            }
            return mapper.readValue(response.body(), type);
        };
    }

    TransportRequest toTransportRequest(ApiRequest request) throws IOException {
        URI uri = URI.create(withQuery(resolve(request.path()).toString(), request.query()));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(ACCEPT, APPLICATION_JSON);
        headers.put(USER_AGENT, config.userAgent());
        if (authorization != null) {
            headers.put(AUTHORIZATION, authorization);
        }
        headers.putAll(config.defaultHeaders());
        headers.putAll(request.headers());

        byte[] body = null;
        boolean replayable = true;
        if (request.hasBody()) {
            headers.put(CONTENT_TYPE, APPLICATION_JSON);
            RequestBody requestBody = request.body();
            replayable = requestBody.isReplayable();
            // A one-shot stream stays unread when the executor is going to refuse it.
            if (replayable || executor.policy().maxAttempts() == 0) {
                body = requestBody.read();
            }
        }
        headers.put(HttpErrorClassifier.REQUEST_ID, requestIds.next());
        headers.put(CLIENT_VERSION, config.clientVersion());

        log.debug("Prepared {} {}", request.method(), uri);
        return new TransportRequest(request.method(), uri, headers, body, config.timeout(), replayable);
    }

    URI resolve(String pathOrUrl) {
        if (pathOrUrl.startsWith("http://") || pathOrUrl.startsWith("https://")) {
            return URI.create(pathOrUrl);
        }
        String base = config.baseUrl().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(pathOrUrl.startsWith("/") ? base + pathOrUrl : base + "/" + pathOrUrl);
    }

    static String withQuery(String url, Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return url;
        }
        StringBuilder sb = new StringBuilder(url);
        char separator = url.indexOf('?') >= 0 ? '&' : '?';
        for (Map.Entry<String, String> parameter : query.entrySet()) {
            sb.append(separator)
                    .append(URLEncoder.encode(parameter.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(parameter.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }
        return sb.toString();
    }

    private static <T> Outcome<T> join(CompletableFuture<Outcome<T>> future) {
        return future.join();
    }
}
