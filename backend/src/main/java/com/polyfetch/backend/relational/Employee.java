package com.polyfetch.backend.relational;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Row of the {@code employees} table as exposed by PostgREST. Every column must be present and non-null;
 * columns beyond these are ignored.
 */
public record Employee(
        @JsonProperty(required = true) int id,
        @JsonProperty(value = "first_name", required = true) String firstName,
        @JsonProperty(required = true) int age,
        @JsonProperty(required = true) String interests,
        @JsonProperty(required = true) String city
) {
}
