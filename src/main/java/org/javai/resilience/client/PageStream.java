package org.javai.resilience.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.resilience.ApiError;
import org.javai.resilience.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily walks a cursor-paginated list endpoint, one item at a time.
 *
 * <p>A page is fetched only when the items of the previous one have been consumed. The
 * first page is fetched from the endpoint with its query; every later page from the
 * server's cursor, verbatim. The walk ends on an empty page or a page without cursor.</p>
 *
 * <p>An item that cannot be decoded is yielded as a {@link Outcome.Fail} and the walk
 * continues. A page that cannot be fetched is yielded as a single {@link Outcome.Fail}
 * and ends the walk.</p>
 *
 * <p>Not thread-safe. A stream cannot be restarted; ask the client for a new one.</p>
 *
 * @param <T> the item type
 */
public final class PageStream<T> implements Iterator<Outcome<T>> {

    private static final Logger log = LoggerFactory.getLogger(PageStream.class);

    private final Function<String, Outcome<JsonNode>> fetcher;
    private final ObjectMapper mapper;
    private final JavaType itemType;
    private final Deque<Outcome<T>> buffer = new ArrayDeque<>();

    private String nextTarget;
    private int pagesFetched;

    /**
     * @param firstTarget URL of the first page
     * @param fetcher loads the page at a URL or cursor
     * @param mapper decodes items
     * @param itemType the item type
     */
    PageStream(String firstTarget, Function<String, Outcome<JsonNode>> fetcher, ObjectMapper mapper, JavaType itemType) {
        this.nextTarget = Objects.requireNonNull(firstTarget, "firstTarget must not be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.itemType = Objects.requireNonNull(itemType, "itemType must not be null");
    }

    @Override
    public boolean hasNext() {
        while (buffer.isEmpty() && nextTarget != null) {
            fetchPage();
        }
        return !buffer.isEmpty();
    }

    @Override
    public Outcome<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items");
        }
        return buffer.removeFirst();
    }

    /**
     * The remaining items as a sequential, lazy stream.
     */
    public Stream<Outcome<T>> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Drains the stream into a list; the first failure aborts and is returned.
     */
    public Outcome<List<T>> collectAll() {
        List<T> items = new ArrayList<>();
        while (hasNext()) {
            Outcome<T> item = next();
            if (item instanceof Outcome.Fail<T> fail) {
                return Outcome.<List<T>>fail(fail.failure()).correlationId(fail.correlationId().orElse(null));
            }
            items.add(((Outcome.Ok<T>) item).value());
        }
        return Outcome.ok(items);
    }

    public int pagesFetched() {
        return pagesFetched;
    }

    private void fetchPage() {
        String target = nextTarget;
        nextTarget = null;
        pagesFetched++;
        log.debug("Fetching page {} from {}", pagesFetched, target);

        Outcome<JsonNode> page = fetcher.apply(target);
        if (page instanceof Outcome.Fail<JsonNode> fail) {
            log.debug("Page {} failed, ending stream: {}", pagesFetched, fail.failure().message());
            buffer.add(Outcome.<T>fail(fail.failure()).correlationId(fail.correlationId().orElse(null)));
            return;
        }

        String correlationId = page.correlationId().orElse(null);
        PageEnvelope envelope = PageEnvelope.parse(((Outcome.Ok<JsonNode>) page).value());
        if (envelope.isEmpty()) {
            return;
        }
        for (JsonNode item : envelope.items()) {
            buffer.add(decode(item).correlationId(correlationId));
        }
        nextTarget = envelope.cursor();
    }

    private Outcome<T> decode(JsonNode item) {
        try {
            T value = mapper.treeToValue(item, itemType);
            return Outcome.ok(value);
        } catch (JsonProcessingException e) {
            return Outcome.fail(ApiError.Network.permanent("Failed to parse item: " + e.getOriginalMessage()));
        } catch (IllegalArgumentException e) {
            return Outcome.fail(ApiError.Network.permanent("Failed to parse item: " + e.getMessage()));
        }
    }
}
