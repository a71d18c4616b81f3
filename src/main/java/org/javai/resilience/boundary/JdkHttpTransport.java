package org.javai.resilience.boundary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Transport} backed by {@link HttpClient#sendAsync}.
 *
 * <p>Each exchange holds a {@link ConnectionSlots} slot from the moment it is sent until
 * its body has been read, so a caller waiting out a backoff never holds one.</p>
 */
public final class JdkHttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private static final String KEEPALIVE_PROPERTY = "jdk.httpclient.keepalive.timeout";
    private static final Object KEEPALIVE_LOCK = new Object();
    private static final Set<String> SENSITIVE_HEADERS = Set.of(
            "authorization", "cookie", "set-cookie", "x-api-key", "x-auth-token");

    private final HttpClient httpClient;
    private final ConnectionSlots slots;

    public JdkHttpTransport(HttpClient httpClient, ConnectionSlots slots) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.slots = Objects.requireNonNull(slots, "slots must not be null");
    }

    /**
     * Creates a transport with its own {@link HttpClient}.
     *
     * @param connectTimeout TCP connect timeout
     * @param maxConnectionsPerHost maximum concurrent exchanges per host
     * @param maxTotalConnections maximum concurrent exchanges overall
     * @param idleTimeout how long an idle pooled connection is kept; see
     *                    {@link #configureIdleTimeout(Duration)} for why only the first
     *                    value in a JVM takes effect
     */
    public static JdkHttpTransport create(
            Duration connectTimeout,
            int maxConnectionsPerHost,
            int maxTotalConnections,
            Duration idleTimeout
    ) {
        configureIdleTimeout(idleTimeout);
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new JdkHttpTransport(client, new ConnectionSlots(maxConnectionsPerHost, maxTotalConnections));
    }

    /**
     * Sets {@code jdk.httpclient.keepalive.timeout} unless it is already set.
     *
     * <p>The property is JVM-wide and the JDK reads it once, when its connection pool is
     * first used. A later transport asking for a different idle timeout cannot change it;
     * that is logged at WARN and the existing value stays in force.</p>
     *
     * @return the idle timeout in seconds that applies to the JVM
     */
    static String configureIdleTimeout(Duration idleTimeout) {
        String requested = String.valueOf(Math.max(1, idleTimeout.toSeconds()));
        synchronized (KEEPALIVE_LOCK) {
            String effective = System.getProperty(KEEPALIVE_PROPERTY);
            if (effective == null) {
                System.setProperty(KEEPALIVE_PROPERTY, requested);
                return requested;
            }
            if (!effective.equals(requested)) {
                log.warn("{} is JVM-wide and already {}s; idle timeout of {}s is ignored",
                        KEEPALIVE_PROPERTY, effective, requested);
            }
            return effective;
        }
    }

    @Override
    public CompletableFuture<TransportResponse> send(TransportRequest request) {
        HttpRequest httpRequest = toHttpRequest(request);
        String host = hostOf(request.uri());

        if (log.isDebugEnabled()) {
            log.debug("HTTP request: {} {}", request.method(), request.uri());
            request.headers().forEach((name, value) ->
                    log.debug("Request header: {}: {}", name, redact(name, value)));
        }

        long started = System.nanoTime();
        CompletableFuture<TransportResponse> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<HttpResponse<String>>> exchangeRef = new AtomicReference<>();
        CompletableFuture<ConnectionSlots.Slot> acquire = slots.acquire(host);

        // Cancelling the returned future withdraws a queued waiter or aborts the exchange.
        result.whenComplete((response, failure) -> {
            if (result.isCancelled()) {
                acquire.cancel(true);
                CompletableFuture<HttpResponse<String>> exchange = exchangeRef.get();
                if (exchange != null) {
                    exchange.cancel(true);
                }
            }
        });

        acquire.whenComplete((slot, acquireFailure) -> {
            if (acquireFailure != null) {
                result.completeExceptionally(acquireFailure);
                return;
            }
            if (result.isDone()) {
                slot.close();
                return;
            }
            CompletableFuture<HttpResponse<String>> exchange;
            try {
                exchange = httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
            } catch (RuntimeException e) {
                slot.close();
                result.completeExceptionally(e);
                return;
            }
            exchangeRef.set(exchange);
            exchange.whenComplete((response, failure) -> {
                slot.close();
                if (failure != null) {
                    result.completeExceptionally(failure);
                    return;
                }
                if (log.isDebugEnabled()) {
                    log.debug("HTTP response: {} {} in {}ms", response.statusCode(), request.uri(),
                            Duration.ofNanos(System.nanoTime() - started).toMillis());
                }
                result.complete(new TransportResponse(response.statusCode(), response.headers().map(), response.body()));
            });
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    public ConnectionSlots slots() {
        return slots;
    }

    private static HttpRequest toHttpRequest(TransportRequest request) {
        HttpRequest.BodyPublisher publisher = request.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .timeout(request.timeout())
                .method(request.method(), publisher);
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private static String hostOf(URI uri) {
        return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }

    static String redact(String name, String value) {
        return isSensitiveHeader(name) ? "[REDACTED]" : value;
    }

    static boolean isSensitiveHeader(String name) {
        return SENSITIVE_HEADERS.contains(name.toLowerCase(Locale.ROOT));
    }
}
