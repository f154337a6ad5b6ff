package com.polyfetch.aggregation;

import java.util.Objects;

/**
 * Keeps only the documents whose {@code field} satisfies {@code predicate}.
 */
public record FilterStage(String field, FieldPredicate predicate) implements Stage {

    public FilterStage {
        Stages.requireText(field, "field");
        Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public String name() {
        return "filter";
    }
}
