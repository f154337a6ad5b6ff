package com.polyfetch.backend.relational;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.polyfetch.backend.BackendClient;
import com.polyfetch.common.BackendException;
import com.polyfetch.common.DecodeException;
import com.polyfetch.common.FetchResult;
import com.polyfetch.common.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Unconditional select-all on one PostgREST table, decoded into {@link Employee} rows in response order.
 */
@Component
@Slf4j
public class RelationalBackend implements BackendClient<List<Employee>> {

    public static final String NAME = "relational";
    static final String API_KEY_HEADER = "apikey";

    private static final TypeReference<List<Employee>> EMPLOYEE_LIST = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectReader employeeReader;
    private final RelationalProperties properties;

    public RelationalBackend(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, RelationalProperties properties) {
        this.webClient = webClientBuilder.build();
        this.employeeReader = objectMapper.readerFor(EMPLOYEE_LIST)
                .with(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES,
                        DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES,
                        DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FetchResult<List<Employee>> fetch() {
        try {
            List<Employee> employees = selectAll();
            for (Employee e : employees) {
                log.debug("Employee: {} // Age: {} // Interests: {} // City: {}", e.firstName(), e.age(), e.interests(), e.city());
            }
            return FetchResult.success(employees);
        } catch (BackendException e) {
            log.warn("Select on {} failed: {}", properties.table(), e.getMessage());
            return FetchResult.failure(NAME, e);
        }
    }

    List<Employee> selectAll() {
        if (!properties.hasApiKey()) {
            throw new AuthException("No API key configured for " + properties.baseUrl());
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.baseUrl())
                .pathSegment(properties.table())
                .queryParam("select", properties.select())
                .build()
                .toUri();
        String body = webClient.get()
                .uri(uri)
                .header(API_KEY_HEADER, properties.apiKey())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, this::mapStatus)
                .onErrorMap(WebClientRequestException.class, e -> new TransportException("GET " + uri + " failed: " + e.getMessage(), e))
                .block();
        return decode(body);
    }

    private BackendException mapStatus(WebClientResponseException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
            return new AuthException(properties.table() + " rejected API key (HTTP " + e.getStatusCode().value() + ")", e);
        }
        return new TransportException(properties.table() + " select failed with HTTP " + e.getStatusCode().value(), e);
    }

    private List<Employee> decode(String body) {
        if (body == null || body.isBlank()) {
            throw new DecodeException("Empty response body from " + properties.table());
        }
        List<Employee> employees;
        try {
            employees = employeeReader.readValue(body);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Unexpected " + properties.table() + " payload: " + e.getOriginalMessage(), e);
        }
        if (employees == null || employees.contains(null)) {
            throw new DecodeException("Unexpected null in " + properties.table() + " payload");
        }
        return List.copyOf(employees);
    }
}
