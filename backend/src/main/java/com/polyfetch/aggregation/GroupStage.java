package com.polyfetch.aggregation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Groups documents by {@code keyField}; each entry of {@code aggregations} becomes one output field of the group.
 * The group key is emitted under {@link #GROUP_KEY_FIELD}. Output field order follows insertion order.
 */
public record GroupStage(String keyField, Map<String, Accumulator> aggregations) implements Stage {

    /** Output field holding the group key in every result document. */
    public static final String GROUP_KEY_FIELD = "_id";

    public GroupStage {
        Stages.requireText(keyField, "keyField");
        Objects.requireNonNull(aggregations, "aggregations");
        aggregations.keySet().forEach(k -> Stages.requireText(k, "aggregation output field"));
        if (aggregations.containsKey(GROUP_KEY_FIELD)) {
            throw new IllegalArgumentException(GROUP_KEY_FIELD + " is reserved for the group key");
        }
        aggregations = Collections.unmodifiableMap(new LinkedHashMap<>(aggregations));
    }

    public static GroupStage by(String keyField) {
        return new GroupStage(keyField, Map.of());
    }

    public GroupStage count(String outputField) {
        return with(outputField, Accumulator.count());
    }

    public GroupStage push(String outputField, String sourceField) {
        return with(outputField, Accumulator.push(sourceField));
    }

    private GroupStage with(String outputField, Accumulator accumulator) {
        Map<String, Accumulator> next = new LinkedHashMap<>(aggregations);
        next.put(outputField, accumulator);
        return new GroupStage(keyField, next);
    }

    @Override
    public String name() {
        return "group";
    }
}
