package org.javai.resilience.client;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Generates {@code X-Request-ID} values of the form {@code <prefix>-<epochMillis>-<uuid without dashes>}.
 */
public final class RequestIds {

    private final String prefix;
    private final Clock clock;

    public RequestIds(String prefix) {
        this(prefix, Clock.systemUTC());
    }

    RequestIds(String prefix, Clock clock) {
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String next() {
        return prefix + "-" + clock.millis() + "-" + UUID.randomUUID().toString().replace("-", "");
    }
}
