package org.javai.resilience.client;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class RequestBodyTest {

    @Test
    void json_isReplayable() throws Exception {
        RequestBody body = RequestBody.json("{\"a\":1}");

        assertThat(body.isReplayable()).isTrue();
        assertThat(body.read()).isEqualTo(body.read());
    }

    @Test
    void json_copiesInput() throws Exception {
        byte[] source = "{}".getBytes(StandardCharsets.UTF_8);
        RequestBody body = RequestBody.json(source);
        source[0] = 'x';

        assertThat(new String(body.read(), StandardCharsets.UTF_8)).isEqualTo("{}");
    }

    @Test
    void stream_readsOnce() throws Exception {
        RequestBody body = RequestBody.stream(new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)));

        assertThat(body.isReplayable()).isFalse();
        assertThat(new String(body.read(), StandardCharsets.UTF_8)).isEqualTo("{}");
        assertThatThrownBy(body::read)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already been consumed");
    }
}
