package org.javai.resilience.boundary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.resilience.ApiError;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies HTTP responses and JDK transport exceptions into {@link ApiError} variants.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>401 → {@link ApiError.Authentication}</li>
 *   <li>403 → {@link ApiError.Authorization}</li>
 *   <li>404 → {@link ApiError.NotFound}</li>
 *   <li>409 → {@link ApiError.Conflict} with {@code Retry-After}</li>
 *   <li>422 → {@link ApiError.Validation} from the first entry of {@code errors[]}</li>
 *   <li>429 → {@link ApiError.RateLimit} with {@code Retry-After}</li>
 *   <li>503 → {@link ApiError.ServiceUnavailable} with {@code Retry-After}</li>
 *   <li>anything else → {@link ApiError.Api} carrying the envelope message and {@code X-Request-ID}</li>
 * </ul>
 *
 * <p>Exceptions raised before a response arrived become {@link ApiError.Timeout} or
 * {@link ApiError.Network}.
 */
public class HttpErrorClassifier implements ErrorClassifier {

    public static final String RETRY_AFTER = "Retry-After";
    public static final String REQUEST_ID = "X-Request-ID";

    private final ObjectMapper mapper;
    private final Duration requestTimeout;

    public HttpErrorClassifier(Duration requestTimeout) {
        this(new ObjectMapper(), requestTimeout);
    }

    public HttpErrorClassifier(ObjectMapper mapper, Duration requestTimeout) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    @Override
    public ApiError classify(TransportResponse response) {
        Objects.requireNonNull(response, "response must not be null");
        int status = response.statusCode();
        Duration retryAfter = parseRetryAfter(response);
        JsonNode json = parseJson(response.body());

        switch (status) {
            case 401:
                return new ApiError.Authentication("Unauthorized - check your API credentials");
            case 403:
                return new ApiError.Authorization("Forbidden - insufficient permissions");
            case 404:
                return new ApiError.NotFound();
            case 409:
                return new ApiError.Conflict(retryAfter);
            case 422:
                ApiError.Validation validation = firstValidationError(json);
                if (validation != null) {
                    return validation;
                }
                return apiError(status, response, json);
            case 429:
                return new ApiError.RateLimit(retryAfter);
            case 503:
                return new ApiError.ServiceUnavailable(retryAfter);
            default:
                return apiError(status, response, json);
        }
    }

    @Override
    public ApiError classify(String operation, Throwable throwable) {
        Throwable t = unwrap(throwable);

        // Timeouts: retryable
        if (t instanceof HttpTimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof TimeoutException) {
            return new ApiError.Timeout(requestTimeout, operation);
        }

        if (hasCause(t, ConnectException.class)) {
            return new ApiError.Network(messageFor("Connection failed", t), false, true);
        }

        if (hasCause(t, UnknownHostException.class)) {
            return ApiError.Network.permanent(messageFor("Unknown host", t));
        }

        // General IO: assume transient unless we know otherwise
        if (t instanceof IOException) {
            return ApiError.Network.retryable(messageFor("IO error", t));
        }

        return ApiError.Network.permanent(messageFor("Unexpected transport failure", t));
    }

    /**
     * Parses {@code Retry-After} as integer seconds.
     *
     * @return the delay, or null when absent or not an integer
     */
    public static Duration parseRetryAfter(TransportResponse response) {
        return response.header(RETRY_AFTER)
                .map(String::trim)
                .map(HttpErrorClassifier::parseSeconds)
                .orElse(null);
    }

    private static Duration parseSeconds(String value) {
        try {
            long seconds = Long.parseLong(value);
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private ApiError.Api apiError(int status, TransportResponse response, JsonNode json) {
        String requestId = response.header(REQUEST_ID).orElse(null);
        if (json != null && json.path("message").isTextual()) {
            return new ApiError.Api(status, json.get("message").asText(), json, requestId);
        }
        return new ApiError.Api(status, response.body(), json, requestId);
    }

    private static ApiError.Validation firstValidationError(JsonNode json) {
        if (json == null) {
            return null;
        }
        JsonNode errors = json.get("errors");
        if (errors == null || !errors.isArray()) {
            return null;
        }
        JsonNode first = errors.path(0);
        String message = textOrNull(first, "message");
        return new ApiError.Validation(
                message != null ? message : "Validation failed",
                textOrNull(first, "field"),
                textOrNull(first, "code"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private JsonNode parseJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable current = t; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static String messageFor(String prefix, Throwable t) {
        return t.getMessage() != null ? prefix + ": " + t.getMessage() : prefix + ": " + t.getClass().getSimpleName();
    }
}
