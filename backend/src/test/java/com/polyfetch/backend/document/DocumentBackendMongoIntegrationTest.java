package com.polyfetch.backend.document;

import com.polyfetch.aggregation.mongo.MongoAggregationExecutor;
import com.polyfetch.aggregation.summary.Summary;
import com.polyfetch.common.FetchResult;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
class DocumentBackendMongoIntegrationTest {

    private static final String COLLECTION = "movies";

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;

    private final Map<Integer, Integer> moviesPerYear = new LinkedHashMap<>();

    @BeforeEach
    void seed() {
        mongoTemplate.dropCollection(COLLECTION);
        moviesPerYear.put(1995, 3);
        moviesPerYear.put(1996, 12);
        moviesPerYear.put(1997, 4);
        moviesPerYear.put(1998, 6);
        moviesPerYear.put(1999, 2);
        moviesPerYear.put(2000, 8);
        moviesPerYear.put(2001, 5);
        moviesPerYear.put(2002, 7);
        moviesPerYear.put(2003, 3);
        moviesPerYear.put(2004, 2);
        moviesPerYear.put(2005, 1);

        List<Document> movies = new ArrayList<>();
        moviesPerYear.forEach((year, count) -> {
            for (int i = 0; i < count; i++) {
                movies.add(new Document("title", title(year, i)).append("year", year));
            }
        });
        // outside the numeric filter
        movies.add(new Document("title", "Lost Reel").append("year", "1994"));
        movies.add(new Document("title", "Undated"));
        mongoTemplate.getCollection(COLLECTION).insertMany(movies);
    }

    private static String title(int year, int i) {
        return "Movie " + year + "-" + i;
    }

    private DocumentBackend backend(int limit) {
        DocumentProperties properties = new DocumentProperties(mongo.getReplicaSetUrl(), mongoTemplate.getDb().getName(),
                COLLECTION, "year", "title", limit, Duration.ofSeconds(5));
        return new DocumentBackend(new MongoAggregationExecutor(mongoTemplate, COLLECTION), properties);
    }

    @Test
    @DisplayName("first ten numeric years ascending, each with its count and titles")
    void fetch_movieSummary() {
        FetchResult<List<Summary>> result = backend(10).fetch();

        assertThat(result.isSuccess()).isTrue();
        List<Summary> summaries = result.getValue().orElseThrow();
        assertThat(summaries).extracting(Summary::key)
                .containsExactly(1995L, 1996L, 1997L, 1998L, 1999L, 2000L, 2001L, 2002L, 2003L, 2004L);
        for (Summary summary : summaries) {
            int year = (int) summary.numericKey();
            int expected = moviesPerYear.get(year);
            assertThat(summary.count()).isEqualTo(expected);
            List<String> titles = new ArrayList<>();
            for (int i = 0; i < expected; i++) {
                titles.add(title(year, i));
            }
            assertThat(summary.items()).containsExactlyInAnyOrderElementsOf(titles);
        }
    }

    @Test
    void fetch_limitLargerThanGroups_returnsAllNumericYears() {
        List<Summary> summaries = backend(50).fetch().getValue().orElseThrow();

        assertThat(summaries).hasSize(moviesPerYear.size());
        assertThat(summaries).allMatch(Summary::isNumericKey);
        assertThat(summaries.get(summaries.size() - 1).key()).isEqualTo(2005L);
    }

    @Test
    void fetch_emptyCollection_emptySummary() {
        mongoTemplate.dropCollection(COLLECTION);

        assertThat(backend(10).fetch().getValue()).contains(List.of());
    }
}
