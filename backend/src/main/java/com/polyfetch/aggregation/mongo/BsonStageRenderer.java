package com.polyfetch.aggregation.mongo;

import com.polyfetch.aggregation.Accumulator;
import com.polyfetch.aggregation.FieldPredicate;
import com.polyfetch.aggregation.FilterStage;
import com.polyfetch.aggregation.GroupStage;
import com.polyfetch.aggregation.LimitStage;
import com.polyfetch.aggregation.Pipeline;
import com.polyfetch.aggregation.SortDirection;
import com.polyfetch.aggregation.SortStage;
import com.polyfetch.aggregation.Stage;
import com.polyfetch.aggregation.TypePredicate;
import org.bson.Document;

import java.util.List;

/**
 * Renders the stage model into MongoDB aggregation stage documents ($match, $group, $sort, $limit).
 */
public final class BsonStageRenderer {

    private BsonStageRenderer() {
    }

    public static List<Document> render(Pipeline pipeline) {
        return pipeline.stages().stream()
                .map(BsonStageRenderer::render)
                .toList();
    }

    static Document render(Stage stage) {
        if (stage instanceof FilterStage filter) {
            return new Document("$match", new Document(filter.field(), predicate(filter.predicate())));
        }
        if (stage instanceof GroupStage group) {
            Document body = new Document(GroupStage.GROUP_KEY_FIELD, fieldRef(group.keyField()));
            group.aggregations().forEach((output, accumulator) -> body.append(output, accumulator(accumulator)));
            return new Document("$group", body);
        }
        if (stage instanceof SortStage sort) {
            int order = sort.direction() == SortDirection.ASCENDING ? 1 : -1;
            return new Document("$sort", new Document(sort.field(), order));
        }
        if (stage instanceof LimitStage limit) {
            return new Document("$limit", limit.count());
        }
        throw new IllegalArgumentException("Unsupported stage: " + stage);
    }

    private static Document predicate(FieldPredicate predicate) {
        if (predicate instanceof TypePredicate type) {
            return new Document("$type", type.typeAlias());
        }
        throw new IllegalArgumentException("Unsupported predicate: " + predicate);
    }

    private static Document accumulator(Accumulator accumulator) {
        return switch (accumulator.op()) {
            case COUNT -> new Document("$sum", 1);
            case PUSH -> new Document("$push", fieldRef(accumulator.sourceField()));
        };
    }

    private static String fieldRef(String field) {
        return "$" + field;
    }
}
