package com.nodewatch.rpcextractor.adapter;

import reactor.core.publisher.Mono;

/**
 * Node JSON-RPC client abstraction for testing. Endpoint and credentials are bound at construction.
 */
public interface NodeRpcClient {

    /**
     * Perform a single parameterless JSON-RPC call.
     *
     * @param method e.g. "getpeerinfo"
     * @return raw response body (JSON); errors with {@link RpcAuthException} on rejected credentials,
     *         {@link RpcException} on HTTP errors without a body, or the transport exception
     */
    Mono<String> call(String method);
}
