package com.polyfetch.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.polyfetch.aggregation.AggregationExecutor;
import com.polyfetch.aggregation.mongo.MongoAggregationExecutor;
import com.polyfetch.backend.document.DocumentProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.concurrent.TimeUnit;

/**
 * MongoDB client built from polyfetch.document; replaces Boot's spring.data.mongodb auto-configuration.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoClient mongoClient(DocumentProperties properties) {
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(properties.uri()))
                .applyToClusterSettings(b -> b.serverSelectionTimeout(
                        properties.serverSelectionTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .build();
        return MongoClients.create(settings);
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoClient mongoClient, DocumentProperties properties) {
        return new MongoTemplate(mongoClient, properties.database());
    }

    @Bean
    public AggregationExecutor aggregationExecutor(MongoTemplate mongoTemplate, DocumentProperties properties) {
        return new MongoAggregationExecutor(mongoTemplate, properties.collection());
    }
}
