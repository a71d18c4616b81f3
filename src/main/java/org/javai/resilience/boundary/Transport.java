package org.javai.resilience.boundary;

import java.util.concurrent.CompletableFuture;

/**
 * Sends one HTTP exchange.
 *
 * <p>The returned future completes with the full response (any status), or completes
 * exceptionally with the transport's exception when no response was received.
 * Implementations must not retry; the {@link org.javai.resilience.retry.RequestExecutor}
 * owns that decision.</p>
 */
@FunctionalInterface
public interface Transport {

    /**
     * Sends a request.
     *
     * @param request the request to send
     * @return a future of the response
     */
    CompletableFuture<TransportResponse> send(TransportRequest request);
}
