package com.polyfetch.backend.document;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Document store connection and the summary pipeline's fields. {@code summaryLimit} is the pipeline's limit stage.
 */
@Validated
@ConfigurationProperties(prefix = "polyfetch.document")
public record DocumentProperties(
        @DefaultValue("mongodb://localhost:27017") @NotBlank String uri,
        @DefaultValue("sample_mflix") @NotBlank String database,
        @DefaultValue("movies") @NotBlank String collection,
        @DefaultValue("year") @NotBlank String groupField,
        @DefaultValue("title") @NotBlank String itemField,
        @DefaultValue("10") @Positive int summaryLimit,
        @DefaultValue("10s") Duration serverSelectionTimeout
) {

    @Override
    public String toString() {
        return "DocumentProperties[uri=" + redact(uri) + ", database=" + database + ", collection=" + collection
                + ", groupField=" + groupField + ", itemField=" + itemField + ", summaryLimit=" + summaryLimit
                + ", serverSelectionTimeout=" + serverSelectionTimeout + "]";
    }

    /** Hides user:password in connection strings. */
    static String redact(String uri) {
        if (uri == null) {
            return null;
        }
        int scheme = uri.indexOf("://");
        int at = uri.indexOf('@');
        if (scheme < 0 || at < scheme) {
            return uri;
        }
        return uri.substring(0, scheme + 3) + "****" + uri.substring(at);
    }
}
