package org.javai.resilience.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a list endpoint: {@code {"data": [...], "next_page": "..."}}.
 *
 * <p>The cursor is read from {@code next_page} when that field is present, even if it is
 * null, and from {@code next} otherwise. A missing or non-array {@code data} is an empty
 * page.</p>
 *
 * @param items the raw items of the page
 * @param cursor where the next page is, or null on the last page
 */
record PageEnvelope(List<JsonNode> items, String cursor) {

    static final String DATA = "data";
    static final String NEXT_PAGE = "next_page";
    static final String NEXT = "next";

    static PageEnvelope parse(JsonNode page) {
        List<JsonNode> items = new ArrayList<>();
        JsonNode data = page == null ? null : page.get(DATA);
        if (data != null && data.isArray()) {
            data.forEach(items::add);
        }
        return new PageEnvelope(List.copyOf(items), cursorOf(page));
    }

    private static String cursorOf(JsonNode page) {
        if (page == null) {
            return null;
        }
        JsonNode cursor = page.has(NEXT_PAGE) ? page.get(NEXT_PAGE) : page.get(NEXT);
        if (cursor == null || !cursor.isTextual() || cursor.asText().isBlank()) {
            return null;
        }
        return cursor.asText();
    }

    boolean isEmpty() {
        return items.isEmpty();
    }

    boolean hasNext() {
        return cursor != null;
    }
}
