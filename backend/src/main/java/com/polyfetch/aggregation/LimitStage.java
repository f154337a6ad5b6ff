package com.polyfetch.aggregation;

/**
 * Passes through only the first {@code count} documents. The store enforces it; clients do not re-apply it.
 */
public record LimitStage(int count) implements Stage {

    public LimitStage {
        if (count <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + count);
        }
    }

    @Override
    public String name() {
        return "limit";
    }
}
