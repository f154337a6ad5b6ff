package com.polyfetch.aggregation.summary;

import java.util.List;
import java.util.Objects;

/**
 * One decoded aggregation group: group key ({@link Long} or {@link String}), document count and collected items.
 */
public record Summary(Object key, long count, List<String> items) {

    public Summary {
        Objects.requireNonNull(key, "key");
        if (!(key instanceof Long) && !(key instanceof String)) {
            throw new IllegalArgumentException("key must be Long or String, got " + key.getClass().getSimpleName());
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
        items = List.copyOf(items);
    }

    public boolean isNumericKey() {
        return key instanceof Long;
    }

    public long numericKey() {
        if (key instanceof Long l) {
            return l;
        }
        throw new IllegalStateException("Summary key is not numeric: " + key);
    }
}
