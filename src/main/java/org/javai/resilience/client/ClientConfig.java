package org.javai.resilience.client;

import org.javai.resilience.ops.OpReporterUtils;
import org.javai.resilience.retry.RetryPolicy;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings of an {@link ApiClient}.
 *
 * <p>Build with {@link #builder(String)}; {@link Builder#build()} validates. Rate limiting
 * and the circuit breaker are off unless configured.</p>
 *
 * @param baseUrl URL that relative request paths are appended to
 * @param timeout per-request timeout
 * @param connectTimeout TCP connect timeout
 * @param retryAttempts retries after the first attempt
 * @param retryDelay delay after the first failed attempt
 * @param maxRetryDelay upper bound of the pre-jitter delay
 * @param retryMultiplier exponential backoff factor
 * @param retryJitter whether backoff delays are randomized
 * @param rateLimitPerWindow requests allowed per rate limit window, or null when unlimited
 * @param rateLimitWindow length of the rate limit window
 * @param circuitBreakerThreshold consecutive failures that open the breaker, or null for no breaker
 * @param circuitBreakerRecovery how long the breaker stays open
 * @param userAgent value of the {@code User-Agent} header
 * @param clientVersion value of the {@code X-Client-Version} header
 * @param requestIdPrefix prefix of generated {@code X-Request-ID} values
 * @param poolSettings connection pool limits
 * @param defaultHeaders headers added to every request
 */
public record ClientConfig(
        URI baseUrl,
        Duration timeout,
        Duration connectTimeout,
        int retryAttempts,
        Duration retryDelay,
        Duration maxRetryDelay,
        double retryMultiplier,
        boolean retryJitter,
        Integer rateLimitPerWindow,
        Duration rateLimitWindow,
        Integer circuitBreakerThreshold,
        Duration circuitBreakerRecovery,
        String userAgent,
        String clientVersion,
        String requestIdPrefix,
        PoolSettings poolSettings,
        Map<String, String> defaultHeaders
) {

    public static final String CLIENT_VERSION = "0.1.0";

    public static final String BASE_URL_PROPERTY = "api.base.url";
    public static final String BASE_URL_ENV = "API_BASE_URL";
    public static final String TIMEOUT_PROPERTY = "api.timeout.seconds";
    public static final String TIMEOUT_ENV = "API_TIMEOUT_SECONDS";
    public static final String RETRY_ATTEMPTS_PROPERTY = "api.retry.attempts";
    public static final String RETRY_ATTEMPTS_ENV = "API_RETRY_ATTEMPTS";

    public ClientConfig {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        Objects.requireNonNull(maxRetryDelay, "maxRetryDelay must not be null");
        Objects.requireNonNull(rateLimitWindow, "rateLimitWindow must not be null");
        Objects.requireNonNull(circuitBreakerRecovery, "circuitBreakerRecovery must not be null");
        Objects.requireNonNull(userAgent, "userAgent must not be null");
        Objects.requireNonNull(clientVersion, "clientVersion must not be null");
        Objects.requireNonNull(requestIdPrefix, "requestIdPrefix must not be null");
        Objects.requireNonNull(poolSettings, "poolSettings must not be null");
        defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
    }

    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /**
     * Reads the base URL from {@value #BASE_URL_PROPERTY} / {@value #BASE_URL_ENV} (required),
     * and optionally the timeout in seconds and the retry count, system property first.
     *
     * @throws IllegalStateException if no base URL is configured
     */
    public static ClientConfig fromEnvironment() {
        Builder builder = builder(OpReporterUtils.resolveConfig(BASE_URL_PROPERTY, BASE_URL_ENV));
        OpReporterUtils.resolveOptional(TIMEOUT_PROPERTY, TIMEOUT_ENV)
                .ifPresent(seconds -> builder.timeout(Duration.ofSeconds(parseInt(TIMEOUT_PROPERTY, seconds))));
        OpReporterUtils.resolveOptional(RETRY_ATTEMPTS_PROPERTY, RETRY_ATTEMPTS_ENV)
                .ifPresent(attempts -> builder.retryAttempts(parseInt(RETRY_ATTEMPTS_PROPERTY, attempts)));
        return builder.build();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid value for " + name + ": " + value, e);
        }
    }

    /**
     * Checks the settings for consistency.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() {
        String scheme = baseUrl.getScheme() == null ? "" : baseUrl.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Invalid URL scheme: only http and https are supported, was: " + baseUrl);
        }
        if (baseUrl.getHost() == null) {
            throw new IllegalArgumentException("Base URL has no host: " + baseUrl);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        if (connectTimeout.compareTo(timeout) > 0) {
            throw new IllegalArgumentException("Connect timeout cannot be greater than request timeout");
        }
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("Retry attempts must be >= 0");
        }
        if (maxRetryDelay.compareTo(retryDelay) < 0) {
            throw new IllegalArgumentException("Max retry delay must be >= retry delay");
        }
        if (!(retryMultiplier > 1.0)) {
            throw new IllegalArgumentException("Retry multiplier must be greater than 1.0");
        }
        if (poolSettings.maxConnectionsPerHost() <= 0 || poolSettings.maxTotalConnections() <= 0) {
            throw new IllegalArgumentException("Connection pool sizes must be greater than zero");
        }
        if (rateLimitPerWindow != null && rateLimitPerWindow <= 0) {
            throw new IllegalArgumentException("Rate limit must be greater than zero");
        }
        if (rateLimitWindow.isZero() || rateLimitWindow.isNegative()) {
            throw new IllegalArgumentException("Rate limit window must be positive");
        }
        if (circuitBreakerThreshold != null && circuitBreakerThreshold <= 0) {
            throw new IllegalArgumentException("Circuit breaker threshold must be greater than zero");
        }
    }

    /**
     * Worst-case time a call may take: every retry waiting for its full timeout plus its
     * backoff, before jitter.
     */
    public Duration totalTimeout() {
        Duration total = Duration.ZERO;
        Duration delay = retryDelay;
        for (int i = 0; i < retryAttempts; i++) {
            total = total.plus(timeout).plus(delay);
            Duration grown = Duration.ofMillis((long) (delay.toMillis() * retryMultiplier));
            delay = grown.compareTo(maxRetryDelay) < 0 ? grown : maxRetryDelay;
        }
        return total;
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryAttempts, retryDelay, maxRetryDelay, retryMultiplier, retryJitter);
    }

    public Optional<Integer> rateLimit() {
        return Optional.ofNullable(rateLimitPerWindow);
    }

    public Optional<Integer> circuitBreaker() {
        return Optional.ofNullable(circuitBreakerThreshold);
    }

    /**
     * Builder for {@link ClientConfig}.
     */
    public static final class Builder {
        private final URI baseUrl;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int retryAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration maxRetryDelay = Duration.ofSeconds(60);
        private double retryMultiplier = 2.0;
        private boolean retryJitter = true;
        private Integer rateLimitPerWindow;
        private Duration rateLimitWindow = Duration.ofSeconds(60);
        private Integer circuitBreakerThreshold;
        private Duration circuitBreakerRecovery = Duration.ofSeconds(30);
        private String userAgent = "javai-resilience/" + CLIENT_VERSION;
        private String clientVersion = CLIENT_VERSION;
        private String requestIdPrefix = "req";
        private PoolSettings poolSettings = PoolSettings.defaults();
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();

        private Builder(String baseUrl) {
            OpReporterUtils.requireNonEmpty(baseUrl, "baseUrl");
            try {
                this.baseUrl = URI.create(baseUrl.trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid base URL: " + baseUrl, e);
            }
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay must not be null");
            return this;
        }

        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = Objects.requireNonNull(maxRetryDelay, "maxRetryDelay must not be null");
            return this;
        }

        public Builder retryMultiplier(double retryMultiplier) {
            this.retryMultiplier = retryMultiplier;
            return this;
        }

        public Builder retryJitter(boolean retryJitter) {
            this.retryJitter = retryJitter;
            return this;
        }

        /**
         * Enables client-side rate limiting.
         *
         * @param requests requests allowed per window
         * @param window window length
         */
        public Builder rateLimit(int requests, Duration window) {
            this.rateLimitPerWindow = requests;
            this.rateLimitWindow = Objects.requireNonNull(window, "window must not be null");
            return this;
        }

        /**
         * Enables the circuit breaker.
         *
         * @param threshold consecutive failures that open it
         * @param recovery how long it stays open before a trial request
         */
        public Builder circuitBreaker(int threshold, Duration recovery) {
            this.circuitBreakerThreshold = threshold;
            this.circuitBreakerRecovery = Objects.requireNonNull(recovery, "recovery must not be null");
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = OpReporterUtils.requireNonEmpty(userAgent, "userAgent");
            return this;
        }

        public Builder clientVersion(String clientVersion) {
            this.clientVersion = OpReporterUtils.requireNonEmpty(clientVersion, "clientVersion");
            return this;
        }

        public Builder requestIdPrefix(String requestIdPrefix) {
            this.requestIdPrefix = OpReporterUtils.requireNonEmpty(requestIdPrefix, "requestIdPrefix");
            return this;
        }

        public Builder poolSettings(PoolSettings poolSettings) {
            this.poolSettings = Objects.requireNonNull(poolSettings, "poolSettings must not be null");
            return this;
        }

        public Builder defaultHeader(String name, String value) {
            defaultHeaders.put(OpReporterUtils.requireNonEmpty(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        /**
         * @throws IllegalArgumentException if the settings are inconsistent
         */
        public ClientConfig build() {
            ClientConfig config = new ClientConfig(baseUrl, timeout, connectTimeout, retryAttempts, retryDelay,
                    maxRetryDelay, retryMultiplier, retryJitter, rateLimitPerWindow, rateLimitWindow,
                    circuitBreakerThreshold, circuitBreakerRecovery, userAgent, clientVersion, requestIdPrefix,
                    poolSettings, defaultHeaders);
            config.validate();
            return config;
        }
    }
}
