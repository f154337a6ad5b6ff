package com.polyfetch.aggregation.mongo;

import com.polyfetch.aggregation.GroupStage;
import com.polyfetch.aggregation.Pipeline;
import com.polyfetch.aggregation.SortDirection;
import com.polyfetch.aggregation.SortStage;
import com.polyfetch.aggregation.summary.SummaryPipelines;
import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BsonStageRendererTest {

    @Test
    @DisplayName("summary pipeline renders to $match, $group, $sort, $limit in that order")
    void render_summaryPipeline() {
        Pipeline pipeline = SummaryPipelines.numericKeySummary("year", "title", 10);

        List<Document> stages = BsonStageRenderer.render(pipeline);

        assertThat(stages).containsExactly(
                Document.parse("{\"$match\": {\"year\": {\"$type\": \"number\"}}}"),
                Document.parse("{\"$group\": {\"_id\": \"$year\", \"count\": {\"$sum\": 1}, \"items\": {\"$push\": \"$title\"}}}"),
                Document.parse("{\"$sort\": {\"_id\": 1}}"),
                Document.parse("{\"$limit\": 10}"));
    }

    @Test
    void render_groupKeepsAccumulatorOrder() {
        Document group = BsonStageRenderer.render(GroupStage.by("genre").push("titles", "title").count("n"));

        assertThat(((Document) group.get("$group")).keySet()).containsExactly("_id", "titles", "n");
    }

    @Test
    void render_descendingSort() {
        Document sort = BsonStageRenderer.render(new SortStage("_id", SortDirection.DESCENDING));

        assertThat(sort).isEqualTo(new Document("$sort", new Document("_id", -1)));
    }
}
