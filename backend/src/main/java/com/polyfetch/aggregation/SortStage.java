package com.polyfetch.aggregation;

import java.util.Objects;

public record SortStage(String field, SortDirection direction) implements Stage {

    public SortStage {
        Stages.requireText(field, "field");
        Objects.requireNonNull(direction, "direction");
    }

    public static SortStage ascending(String field) {
        return new SortStage(field, SortDirection.ASCENDING);
    }

    @Override
    public String name() {
        return "sort";
    }
}
