package com.polyfetch.backend.rpc;

import reactor.core.publisher.Mono;

/**
 * NEAR JSON-RPC client abstraction so the backend can be tested without a node.
 */
public interface NearRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "query"
     * @param params      method params (object or array)
     * @return response body as string (JSON), including JSON-RPC error bodies; errors with {@link RpcException}
     * when no JSON-RPC answer was received
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
