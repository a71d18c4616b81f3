package org.javai.resilience.boundary;

import java.io.IOException;

/**
 * Turns a successful response into the caller's value.
 *
 * <p>An {@link IOException} (Jackson's {@code JsonProcessingException} included) or an
 * {@link IllegalArgumentException} means the body did not have the expected shape; the
 * executor reports it through {@link ErrorClassifier#decodeFailure(String)}.
 *
 * @param <T> the decoded type
 */
@FunctionalInterface
public interface ResponseDecoder<T> {

    T decode(TransportResponse response) throws IOException;

    /**
     * Ignores the body; for endpoints answering 204 No Content.
     */
    static ResponseDecoder<Void> discarding() {
        return response -> null;
    }
}
