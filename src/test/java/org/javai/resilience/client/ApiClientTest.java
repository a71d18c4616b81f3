package org.javai.resilience.client;

import org.javai.resilience.ApiError;
import org.javai.resilience.Outcome;
import org.javai.resilience.boundary.ScriptedTransport;
import org.javai.resilience.boundary.TransportRequest;
import org.javai.resilience.retry.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ApiClientTest {

    public record Order(String id, int total) {
    }

    private ScriptedTransport transport;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        sleeper = new RecordingSleeper();
    }

    private ApiClient client(ClientConfig config) {
        return ApiClient.builder(config).transport(transport).sleeper(sleeper).build();
    }

    private ApiClient client() {
        return client(ClientConfig.builder("http://api.test/v1").retryAttempts(0).build());
    }

    @Test
    void get_decodesJsonBody() {
        transport.respond(200, "{\"id\":\"o-1\",\"total\":42}");

        Outcome<Order> result = client().get("/orders/o-1", Order.class);

        assertThat(result.getOrThrow()).isEqualTo(new Order("o-1", 42));
        assertThat(transport.requests().get(0).method()).isEqualTo("GET");
        assertThat(transport.requests().get(0).uri()).isEqualTo(URI.create("http://api.test/v1/orders/o-1"));
    }

    @Test
    void get_sendsStandardHeaders() {
        transport.respond(200, "{\"id\":\"o-1\",\"total\":1}");

        Outcome<Order> result = client().get("/orders/o-1", Order.class);

        Map<String, String> headers = transport.requests().get(0).headers();
        assertThat(headers)
                .containsEntry("Accept", "application/json")
                .containsEntry("User-Agent", "javai-resilience/0.1.0")
                .containsEntry("X-Client-Version", ClientConfig.CLIENT_VERSION)
                .doesNotContainKey("Authorization")
                .doesNotContainKey("Content-Type");
        assertThat(headers.get("X-Request-ID")).matches("req-\\d+-[0-9a-f]{32}");
        assertThat(result.correlationId()).contains(headers.get("X-Request-ID"));
    }

    @Test
    void get_eachRequestGetsItsOwnRequestId() {
        transport.respondAlways(200, "{\"id\":\"o-1\",\"total\":1}");
        ApiClient client = client();

        client.get("/orders/o-1", Order.class);
        client.get("/orders/o-1", Order.class);

        List<TransportRequest> requests = transport.requests();
        assertThat(requests.get(0).headers().get("X-Request-ID"))
                .isNotEqualTo(requests.get(1).headers().get("X-Request-ID"));
    }

    @Test
    void get_withQuery_encodesParameters() {
        transport.respond(200, "{\"id\":\"o-1\",\"total\":1}");
        Map<String, String> query = new LinkedHashMap<>();
        query.put("status", "open");
        query.put("q", "a b&c");

        client().get("/orders", query, Order.class);

        assertThat(transport.requests().get(0).uri().toString())
                .isEqualTo("http://api.test/v1/orders?status=open&q=a+b%26c");
    }

    @Test
    void defaultHeadersAndRequestHeaders_areSent() {
        transport.respond(200, "{\"id\":\"o-1\",\"total\":1}");
        ApiClient client = client(ClientConfig.builder("http://api.test/v1")
                .retryAttempts(0)
                .defaultHeader("X-Tenant", "acme")
                .build());

        client.send(ApiRequest.get("/orders/o-1").header("X-Trace", "t-1"), Order.class);

        assertThat(transport.requests().get(0).headers())
                .containsEntry("X-Tenant", "acme")
                .containsEntry("X-Trace", "t-1");
    }

    @Test
    void authenticate_addsAuthorizationAndSharesExecutor() {
        transport.respond(200, "{\"id\":\"o-1\",\"total\":1}");
        ApiClient client = client();

        ApiClient authed = client.authenticate("Bearer secret");
        authed.get("/orders/o-1", Order.class);

        assertThat(client.isAuthenticated()).isFalse();
        assertThat(authed.isAuthenticated()).isTrue();
        assertThat(authed.executor()).isSameAs(client.executor());
        assertThat(transport.requests().get(0).headers()).containsEntry("Authorization", "Bearer secret");
    }

    @Test
    void authenticate_blankValue_throws() {
        assertThatThrownBy(() -> client().authenticate(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void post_serializesBodyAndSetsContentType() {
        transport.respond(201, "{\"id\":\"o-2\",\"total\":7}");

        Outcome<Order> result = client().post("/orders", Map.of("total", 7), Order.class);

        TransportRequest request = transport.requests().get(0);
        assertThat(result.getOrThrow()).isEqualTo(new Order("o-2", 7));
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.headers()).containsEntry("Content-Type", "application/json");
        assertThat(new String(request.body(), StandardCharsets.UTF_8)).isEqualTo("{\"total\":7}");
    }

    @Test
    void post_streamBodyWithRetries_failsWithoutSending() {
        ApiClient client = client(ClientConfig.builder("http://api.test/v1").retryAttempts(3).build());
        ByteArrayInputStream upload = new ByteArrayInputStream("{\"total\":7}".getBytes(StandardCharsets.UTF_8));

        Outcome<Order> result = client.post("/orders", RequestBody.stream(upload), Order.class);

        assertThat(result.isFail()).isTrue();
        assertThat(result.error()).get().isInstanceOf(ApiError.Network.class);
        assertThat(result.error().get().isRetryable()).isFalse();
        assertThat(transport.requestCount()).isZero();
        assertThat(upload.available()).isEqualTo(11);
    }

    @Test
    void post_streamBodyWithoutRetries_isSent() {
        transport.respond(201, "{\"id\":\"o-3\",\"total\":7}");
        ByteArrayInputStream upload = new ByteArrayInputStream("{\"total\":7}".getBytes(StandardCharsets.UTF_8));

        Outcome<Order> result = client().post("/orders", RequestBody.stream(upload), Order.class);

        assertThat(result.getOrThrow().id()).isEqualTo("o-3");
        assertThat(new String(transport.requests().get(0).body(), StandardCharsets.UTF_8)).isEqualTo("{\"total\":7}");
    }

    @Test
    void get_serverErrorThenSuccess_retries() {
        transport.respond(503, "").respond(200, "{\"id\":\"o-1\",\"total\":1}");
        ApiClient client = client(ClientConfig.builder("http://api.test/v1").retryJitter(false).build());

        Outcome<Order> result = client.get("/orders/o-1", Order.class);

        assertThat(result.isOk()).isTrue();
        assertThat(transport.requestCount()).isEqualTo(2);
        assertThat(sleeper.delays()).hasSize(1);
    }

    @Test
    void get_notFound_failsWithoutRetry() {
        transport.respond(404, "");
        ApiClient client = client(ClientConfig.builder("http://api.test/v1").build());

        Outcome<Order> result = client.get("/orders/missing", Order.class);

        assertThat(result.error()).contains(new ApiError.NotFound());
        assertThat(transport.requestCount()).isEqualTo(1);
    }

    @Test
    void deleteNoContent_emptyResponse_isOk() {
        transport.respond(204, "");

        Outcome<Void> result = client().deleteNoContent("/orders/o-1");

        assertThat(result.isOk()).isTrue();
        assertThat(transport.requests().get(0).method()).isEqualTo("DELETE");
    }

    @Test
    void count_sendsCountOnlyAndReadsCount() {
        transport.respond(200, "{\"count\":17}");

        Outcome<Long> result = client().count("/orders", Map.of("status", "open"));

        assertThat(result.getOrThrow()).isEqualTo(17L);
        assertThat(transport.requestCount()).isEqualTo(1);
        assertThat(transport.requests().get(0).uri().getQuery()).contains("count_only=true").contains("status=open");
    }

    @Test
    void count_fallsBackToTotalCount() {
        transport.respond(200, "{\"total_count\":5}");

        assertThat(client().count("/orders", Map.of()).getOrThrow()).isEqualTo(5L);
    }

    @Test
    void count_missingField_isDecodeFailure() {
        transport.respond(200, "{\"items\":[]}");

        Outcome<Long> result = client().count("/orders", Map.of());

        assertThat(result.error()).get().isInstanceOf(ApiError.Network.class);
    }

    @Test
    void stream_followsCursorsAcrossPages() {
        transport
                .respond(200, "{\"data\":[{\"id\":\"a\",\"total\":1},{\"id\":\"b\",\"total\":2}],\"next_page\":\"/orders?cursor=2\"}")
                .respond(200, "{\"data\":[{\"id\":\"c\",\"total\":3}],\"next\":\"http://api.test/v1/orders?cursor=3\"}")
                .respond(200, "{\"data\":[]}");

        List<String> ids = client().stream("/orders", Map.of("limit", "2"), Order.class).stream()
                .map(item -> item.getOrThrow().id())
                .toList();

        assertThat(ids).containsExactly("a", "b", "c");
        assertThat(transport.requests()).extracting(request -> request.uri().toString()).containsExactly(
                "http://api.test/v1/orders?limit=2",
                "http://api.test/v1/orders?cursor=2",
                "http://api.test/v1/orders?cursor=3");
    }

    @Test
    void stream_isLazy() {
        transport.respond(200, "{\"data\":[{\"id\":\"a\",\"total\":1}],\"next_page\":\"/orders?cursor=2\"}");

        PageStream<Order> stream = client().stream("/orders", Order.class);

        assertThat(transport.requestCount()).isZero();
        assertThat(stream.next().getOrThrow().id()).isEqualTo("a");
        assertThat(transport.requestCount()).isEqualTo(1);
    }

    @Test
    void resolve_absoluteUrl_isKeptVerbatim() {
        ApiClient client = client();

        assertThat(client.resolve("https://other.test/x?y=1")).isEqualTo(URI.create("https://other.test/x?y=1"));
        assertThat(client.resolve("orders")).isEqualTo(URI.create("http://api.test/v1/orders"));
        assertThat(client.resolve("/orders")).isEqualTo(URI.create("http://api.test/v1/orders"));
    }

    @Test
    void withQuery_existingQuery_appendsWithAmpersand() {
        assertThat(ApiClient.withQuery("http://api.test/orders?a=1", Map.of("b", "2")))
                .isEqualTo("http://api.test/orders?a=1&b=2");
        assertThat(ApiClient.withQuery("http://api.test/orders", Map.of())).isEqualTo("http://api.test/orders");
    }

    @Test
    void create_breakerAndLimiterFromConfig() {
        ApiClient client = client(ClientConfig.builder("http://api.test/v1")
                .circuitBreaker(2, Duration.ofSeconds(10))
                .rateLimit(5, Duration.ofSeconds(1))
                .build());

        assertThat(client.executor().circuitBreaker()).isNotNull();
        assertThat(client.executor().rateLimiter()).isNotNull();
        assertThat(client().executor().circuitBreaker()).isNull();
    }
}
