package com.polyfetch.aggregation.mongo;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoCursor;
import com.polyfetch.aggregation.AggregationExecutor;
import com.polyfetch.aggregation.BackendUnavailableException;
import com.polyfetch.aggregation.Pipeline;
import com.polyfetch.aggregation.PipelineRejectedException;
import com.polyfetch.common.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Executes pipelines against one collection through the native driver cursor, so results stream in batches
 * instead of being materialized. Pings the database first to tell "unreachable" apart from "rejected".
 */
@Slf4j
public class MongoAggregationExecutor implements AggregationExecutor {

    private static final Document PING = new Document("ping", 1);

    private final MongoTemplate mongoTemplate;
    private final String collectionName;

    public MongoAggregationExecutor(MongoTemplate mongoTemplate, String collectionName) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
    }

    @Override
    public Stream<Document> execute(Pipeline pipeline) {
        Objects.requireNonNull(pipeline, "pipeline");
        ping();
        List<Document> stages = BsonStageRenderer.render(pipeline);
        log.debug("Aggregating {} on {}: {}", pipeline, collectionName, stages);
        MongoCursor<Document> cursor = openCursor(stages);
        Iterator<Document> documents = new TranslatingIterator(cursor);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(documents, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(cursor::close);
    }

    private void ping() {
        String database = mongoTemplate.getDb().getName();
        try {
            mongoTemplate.getDb().runCommand(PING);
        } catch (MongoException e) {
            throw new BackendUnavailableException("Cannot reach database " + database + ": " + e.getMessage(), e);
        }
        log.info("Connected to {} database successfully", database);
    }

    private MongoCursor<Document> openCursor(List<Document> stages) {
        try {
            return mongoTemplate.getCollection(collectionName).aggregate(stages).cursor();
        } catch (MongoCommandException e) {
            throw new PipelineRejectedException("Aggregation on " + collectionName + " rejected ("
                    + e.getErrorCodeName() + "): " + e.getErrorMessage(), e);
        } catch (MongoTimeoutException | MongoSocketException e) {
            throw new BackendUnavailableException("Lost connection before aggregating " + collectionName
                    + ": " + e.getMessage(), e);
        } catch (MongoException e) {
            throw new TransportException("Aggregation on " + collectionName + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Maps driver failures raised while the cursor fetches further batches.
     */
    private static final class TranslatingIterator implements Iterator<Document> {

        private final MongoCursor<Document> cursor;

        private TranslatingIterator(MongoCursor<Document> cursor) {
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            try {
                return cursor.hasNext();
            } catch (MongoException e) {
                throw new TransportException("Cursor iteration failed: " + e.getMessage(), e);
            }
        }

        @Override
        public Document next() {
            try {
                return cursor.next();
            } catch (MongoException e) {
                throw new TransportException("Cursor iteration failed: " + e.getMessage(), e);
            }
        }
    }
}
