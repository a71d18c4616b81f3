package org.javai.resilience.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.resilience.ApiError;
import org.javai.resilience.Outcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

class PageStreamTest {

    public record Item(String id, int qty) {
    }

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, Outcome<JsonNode>> pages = new HashMap<>();
    private final List<String> fetched = new ArrayList<>();

    private void page(String target, String json) {
        try {
            pages.put(target, Outcome.ok(mapper.readTree(json)).correlationId("req-" + target));
        } catch (JsonProcessingException e) {
            throw new AssertionError(e);
        }
    }

    private PageStream<Item> streamFrom(String first) {
        return new PageStream<>(first, target -> {
            fetched.add(target);
            return pages.getOrDefault(target, Outcome.fail(new ApiError.NotFound()));
        }, mapper, mapper.constructType(Item.class));
    }

    @Test
    void iterate_followsNextPageUntilNoCursor() {
        page("p1", "{\"data\":[{\"id\":\"a\",\"qty\":1},{\"id\":\"b\",\"qty\":2}],\"next_page\":\"p2\"}");
        page("p2", "{\"data\":[{\"id\":\"c\",\"qty\":3}]}");

        PageStream<Item> stream = streamFrom("p1");

        assertThat(stream.collectAll().getOrThrow()).extracting(Item::id).containsExactly("a", "b", "c");
        assertThat(fetched).containsExactly("p1", "p2");
        assertThat(stream.pagesFetched()).isEqualTo(2);
    }

    @Test
    void iterate_emptyPage_endsEvenWithCursor() {
        page("p1", "{\"data\":[],\"next_page\":\"p2\"}");

        PageStream<Item> stream = streamFrom("p1");

        assertThat(stream.hasNext()).isFalse();
        assertThat(fetched).containsExactly("p1");
    }

    @Test
    void next_exhausted_throws() {
        page("p1", "{\"data\":[]}");

        PageStream<Item> stream = streamFrom("p1");

        assertThatThrownBy(stream::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void iterate_itemsCarryPageCorrelationId() {
        page("p1", "{\"data\":[{\"id\":\"a\",\"qty\":1}]}");

        assertThat(streamFrom("p1").next().correlationId()).contains("req-p1");
    }

    @Test
    void iterate_badItem_yieldsFailureAndContinues() {
        page("p1", "{\"data\":[{\"id\":\"a\",\"qty\":1},{\"id\":\"b\",\"qty\":\"lots\"},{\"id\":\"c\",\"qty\":3}]}");

        List<Outcome<Item>> items = streamFrom("p1").stream().toList();

        assertThat(items).hasSize(3);
        assertThat(items.get(0).isOk()).isTrue();
        assertThat(items.get(1).error()).get()
                .isInstanceOf(ApiError.Network.class)
                .extracting(ApiError::message).asString().contains("Failed to parse item");
        assertThat(items.get(2).getOrThrow().id()).isEqualTo("c");
    }

    @Test
    void iterate_badItem_laterPagesStillFetched() {
        page("p1", "{\"data\":[{\"id\":\"a\",\"qty\":\"lots\"}],\"next_page\":\"p2\"}");
        page("p2", "{\"data\":[{\"id\":\"b\",\"qty\":2}]}");

        List<Outcome<Item>> items = streamFrom("p1").stream().toList();

        assertThat(items).hasSize(2);
        assertThat(items.get(0).isFail()).isTrue();
        assertThat(items.get(1).getOrThrow().id()).isEqualTo("b");
        assertThat(fetched).containsExactly("p1", "p2");
    }

    @Test
    void iterate_pageFailure_yieldsOneFailureAndEnds() {
        page("p1", "{\"data\":[{\"id\":\"a\",\"qty\":1}],\"next_page\":\"missing\"}");

        List<Outcome<Item>> items = streamFrom("p1").stream().toList();

        assertThat(items).hasSize(2);
        assertThat(items.get(1).error()).contains(new ApiError.NotFound());
        assertThat(fetched).containsExactly("p1", "missing");
    }

    @Test
    void collectAll_firstFailureAborts() {
        page("p1", "{\"data\":[{\"id\":\"a\",\"qty\":1}],\"next_page\":\"missing\"}");

        Outcome<List<Item>> all = streamFrom("p1").collectAll();

        assertThat(all.error()).contains(new ApiError.NotFound());
    }

    @Test
    void iterate_fetchesNextPageOnlyWhenNeeded() {
        page("p1", "{\"data\":[{\"id\":\"a\",\"qty\":1},{\"id\":\"b\",\"qty\":2}],\"next_page\":\"p2\"}");
        page("p2", "{\"data\":[{\"id\":\"c\",\"qty\":3}]}");
        PageStream<Item> stream = streamFrom("p1");

        stream.next();
        stream.next();

        assertThat(stream.pagesFetched()).isEqualTo(1);
        stream.next();
        assertThat(stream.pagesFetched()).isEqualTo(2);
    }
}
