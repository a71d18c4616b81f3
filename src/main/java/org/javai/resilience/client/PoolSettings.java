package org.javai.resilience.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection pool limits.
 *
 * @param maxConnectionsPerHost concurrent exchanges allowed per host
 * @param maxTotalConnections concurrent exchanges allowed overall
 * @param idleTimeout how long an idle connection is kept open; applied through a JVM-wide
 *                    property, so only the first client created in a JVM sets it
 * @param keepAliveTimeout keep-alive advertised for pooled connections
 */
public record PoolSettings(
        int maxConnectionsPerHost,
        int maxTotalConnections,
        Duration idleTimeout,
        Duration keepAliveTimeout
) {

    public PoolSettings {
        Objects.requireNonNull(idleTimeout, "idleTimeout must not be null");
        Objects.requireNonNull(keepAliveTimeout, "keepAliveTimeout must not be null");
    }

    /**
     * 10 per host, 100 total, 30s idle, 90s keep-alive.
     */
    public static PoolSettings defaults() {
        return new PoolSettings(10, 100, Duration.ofSeconds(30), Duration.ofSeconds(90));
    }
}
