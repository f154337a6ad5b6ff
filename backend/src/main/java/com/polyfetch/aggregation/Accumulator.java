package com.polyfetch.aggregation;

import java.util.Objects;

/**
 * Per-group aggregation. {@code sourceField} is null for {@link AccumulatorOp#COUNT}.
 */
public record Accumulator(AccumulatorOp op, String sourceField) {

    public Accumulator {
        Objects.requireNonNull(op, "op");
        if (op == AccumulatorOp.PUSH) {
            Stages.requireText(sourceField, "sourceField");
        } else if (sourceField != null) {
            throw new IllegalArgumentException(op + " takes no source field");
        }
    }

    public static Accumulator count() {
        return new Accumulator(AccumulatorOp.COUNT, null);
    }

    public static Accumulator push(String sourceField) {
        return new Accumulator(AccumulatorOp.PUSH, sourceField);
    }
}
