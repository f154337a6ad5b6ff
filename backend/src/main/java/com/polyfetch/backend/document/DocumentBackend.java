package com.polyfetch.backend.document;

import com.polyfetch.aggregation.AggregationExecutor;
import com.polyfetch.aggregation.Pipeline;
import com.polyfetch.aggregation.summary.Summary;
import com.polyfetch.aggregation.summary.SummaryDecoder;
import com.polyfetch.aggregation.summary.SummaryPipelines;
import com.polyfetch.backend.BackendClient;
import com.polyfetch.common.BackendException;
import com.polyfetch.common.FetchResult;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Grouped, sorted, limited summary over one collection. The pipeline is built once; results are decoded one
 * document at a time while the cursor advances.
 */
@Component
@Slf4j
public class DocumentBackend implements BackendClient<List<Summary>> {

    public static final String NAME = "document";

    private final AggregationExecutor executor;
    private final SummaryDecoder decoder = new SummaryDecoder();
    private final Pipeline pipeline;

    public DocumentBackend(AggregationExecutor executor, DocumentProperties properties) {
        this.executor = executor;
        this.pipeline = SummaryPipelines.numericKeySummary(
                properties.groupField(), properties.itemField(), properties.summaryLimit());
    }

    @Override
    public String name() {
        return NAME;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    @Override
    public FetchResult<List<Summary>> fetch() {
        try {
            return FetchResult.success(summarize());
        } catch (BackendException e) {
            log.warn("Summary aggregation failed: {}", e.getMessage());
            return FetchResult.failure(NAME, e);
        }
    }

    List<Summary> summarize() {
        List<Summary> summaries = new ArrayList<>();
        try (Stream<Document> documents = executor.execute(pipeline)) {
            Iterator<Document> it = documents.iterator();
            while (it.hasNext()) {
                Summary summary = decoder.decode(it.next());
                log.debug("* // {} // {} {} //", summary.key(), summary.count(), summary.items());
                summaries.add(summary);
            }
        }
        return List.copyOf(summaries);
    }
}
