package com.nodewatch.rpcextractor.adapter;

/**
 * Node rejected the supplied credentials (HTTP 401/403).
 */
public class RpcAuthException extends RpcException {

    public RpcAuthException(String message) {
        super(message);
    }
}
