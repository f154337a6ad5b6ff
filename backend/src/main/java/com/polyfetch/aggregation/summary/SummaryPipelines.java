package com.polyfetch.aggregation.summary;

import com.polyfetch.aggregation.FieldPredicate;
import com.polyfetch.aggregation.FilterStage;
import com.polyfetch.aggregation.GroupStage;
import com.polyfetch.aggregation.LimitStage;
import com.polyfetch.aggregation.Pipeline;
import com.polyfetch.aggregation.SortStage;

/**
 * Pipelines whose output {@link SummaryDecoder} understands.
 */
public final class SummaryPipelines {

    private SummaryPipelines() {
    }

    /**
     * Filter numeric {@code keyField}, group by it counting documents and pushing {@code itemField},
     * sort groups by key ascending, keep the first {@code limit}.
     */
    public static Pipeline numericKeySummary(String keyField, String itemField, int limit) {
        return Pipeline.of(
                new FilterStage(keyField, FieldPredicate.isNumber()),
                GroupStage.by(keyField)
                        .count(SummaryDecoder.COUNT_FIELD)
                        .push(SummaryDecoder.ITEMS_FIELD, itemField),
                SortStage.ascending(GroupStage.GROUP_KEY_FIELD),
                new LimitStage(limit));
    }
}
