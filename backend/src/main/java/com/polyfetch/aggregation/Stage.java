package com.polyfetch.aggregation;

/**
 * One server-side aggregation operation. Stages only describe intent; rendering and execution belong to an
 * {@link AggregationExecutor}.
 */
public sealed interface Stage permits FilterStage, GroupStage, SortStage, LimitStage {

    /**
     * Short stage name for logging, e.g. "filter", "group".
     */
    String name();
}
