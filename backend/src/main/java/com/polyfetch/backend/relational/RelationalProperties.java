package com.polyfetch.backend.relational;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * PostgREST endpoint ({@code baseUrl} already includes the REST prefix, e.g. {@code https://x.supabase.co/rest/v1}).
 * The API key is optional here so that a missing key fails only this backend.
 */
@Validated
@ConfigurationProperties(prefix = "polyfetch.relational")
public record RelationalProperties(
        @NotBlank String baseUrl,
        String apiKey,
        @DefaultValue("employees") @NotBlank String table,
        @DefaultValue("*") @NotBlank String select
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "RelationalProperties[baseUrl=" + baseUrl + ", apiKey=" + (hasApiKey() ? "****" : "<unset>")
                + ", table=" + table + ", select=" + select + "]";
    }
}
