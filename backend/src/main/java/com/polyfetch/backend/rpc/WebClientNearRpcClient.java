package com.polyfetch.backend.rpc;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * NEAR JSON-RPC 2.0 client using WebClient. Error statuses that still carry a JSON-RPC error body are passed
 * through so the caller can inspect the error cause.
 */
public class WebClientNearRpcClient implements NearRpcClient {

    private static final String REQUEST_ID = "polyfetch";

    private final WebClient webClient;

    public WebClientNearRpcClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", REQUEST_ID,
                "method", method,
                "params", params != null ? params : Map.of()
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorResume(WebClientResponseException.class, e -> {
                    String errorBody = e.getResponseBodyAsString();
                    if (errorBody.contains("\"error\"")) {
                        return Mono.just(errorBody);
                    }
                    return Mono.error(new RpcException(method + " failed with HTTP " + e.getStatusCode().value(), e));
                })
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(method + " request failed: " + e.getMessage(), e));
    }
}
