package com.polyfetch.aggregation;

/**
 * Condition a {@link FilterStage} applies to a single field.
 */
public sealed interface FieldPredicate permits TypePredicate {

    /**
     * Matches any numeric BSON type (int, long, double, decimal).
     */
    static FieldPredicate isNumber() {
        return new TypePredicate(TypePredicate.NUMBER);
    }
}
