package com.polyfetch.aggregation;

import org.bson.Document;

import java.util.stream.Stream;

/**
 * Runs a {@link Pipeline} against the document store.
 */
public interface AggregationExecutor {

    /**
     * Execute the pipeline server-side and expose the results as a lazy, single-pass stream backed by one cursor.
     * Documents are pulled one at a time as the stream advances; callers must close the stream.
     * Failures while advancing the stream surface as {@link com.polyfetch.common.TransportException}.
     *
     * @throws BackendUnavailableException if the store cannot be reached
     * @throws PipelineRejectedException   if the store refuses a stage
     */
    Stream<Document> execute(Pipeline pipeline);
}
