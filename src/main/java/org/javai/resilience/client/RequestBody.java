package org.javai.resilience.client;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A request payload.
 *
 * <p>Buffered bodies can be sent any number of times. A stream body can be read only once,
 * so it is accepted only by clients configured without retries.</p>
 */
public final class RequestBody {

    private final byte[] bytes;
    private final InputStream stream;
    private final AtomicBoolean consumed = new AtomicBoolean();

    private RequestBody(byte[] bytes, InputStream stream) {
        this.bytes = bytes;
        this.stream = stream;
    }

    /**
     * A buffered JSON payload.
     */
    public static RequestBody json(byte[] bytes) {
        return new RequestBody(Objects.requireNonNull(bytes, "bytes must not be null").clone(), null);
    }

    public static RequestBody json(String json) {
        return new RequestBody(Objects.requireNonNull(json, "json must not be null").getBytes(StandardCharsets.UTF_8), null);
    }

    /**
     * A one-shot payload read from {@code stream} when the request is sent.
     */
    public static RequestBody stream(InputStream stream) {
        return new RequestBody(null, Objects.requireNonNull(stream, "stream must not be null"));
    }

    public boolean isReplayable() {
        return bytes != null;
    }

    /**
     * Returns the payload bytes, draining the stream of a one-shot body.
     *
     * @throws IllegalStateException if a one-shot body was already read
     * @throws IOException if the stream cannot be read
     */
    byte[] read() throws IOException {
        if (bytes != null) {
            return bytes;
        }
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Stream body has already been consumed");
        }
        try (InputStream in = stream) {
            return in.readAllBytes();
        }
    }
}
