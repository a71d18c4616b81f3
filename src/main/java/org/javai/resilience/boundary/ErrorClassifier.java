package org.javai.resilience.boundary;

import org.javai.resilience.ApiError;

/**
 * Classifies raw transport outcomes into structured {@link ApiError}s.
 * Implementations should provide deterministic, context-aware classification.
 */
public interface ErrorClassifier {

    /**
     * Classifies a completed exchange whose status is not 2xx.
     *
     * @param response the response received
     * @return the classified error
     */
    ApiError classify(TransportResponse response);

    /**
     * Classifies a failure where no response was received.
     *
     * @param operation the operation that was being performed
     * @param throwable the transport exception
     * @return the classified error
     */
    ApiError classify(String operation, Throwable throwable);

    /**
     * Classifies a success response whose body could not be decoded.
     *
     * @param detail what failed to decode
     * @return the classified error
     */
    default ApiError decodeFailure(String detail) {
        return ApiError.Network.permanent("Failed to parse JSON response: " + detail);
    }
}
