package org.javai.resilience.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PageEnvelopeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private PageEnvelope parse(String json) throws Exception {
        return PageEnvelope.parse(mapper.readTree(json));
    }

    @Test
    void parse_nextPagePreferredOverNext() throws Exception {
        assertThat(parse("{\"data\":[1],\"next_page\":\"a\",\"next\":\"b\"}").cursor()).isEqualTo("a");
    }

    @Test
    void parse_nullNextPage_hidesNext() throws Exception {
        PageEnvelope envelope = parse("{\"data\":[1],\"next_page\":null,\"next\":\"b\"}");

        assertThat(envelope.hasNext()).isFalse();
    }

    @Test
    void parse_onlyNext_isUsed() throws Exception {
        assertThat(parse("{\"data\":[1],\"next\":\"b\"}").cursor()).isEqualTo("b");
    }

    @Test
    void parse_blankCursor_isLastPage() throws Exception {
        assertThat(parse("{\"data\":[1],\"next_page\":\"  \"}").hasNext()).isFalse();
    }

    @Test
    void parse_missingData_isEmpty() throws Exception {
        PageEnvelope envelope = parse("{\"next_page\":\"a\"}");

        assertThat(envelope.isEmpty()).isTrue();
        assertThat(envelope.items()).isEmpty();
    }

    @Test
    void parse_itemsInOrder() throws Exception {
        assertThat(parse("{\"data\":[1,2,3]}").items()).extracting(node -> node.asInt()).containsExactly(1, 2, 3);
    }
}
