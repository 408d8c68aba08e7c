package com.nodewatch.rpcextractor.publish;

import java.time.Instant;

/**
 * One successful RPC result on its way to the bus.
 *
 * @param payload raw JSON of the RPC result
 */
public record RpcEvent(String method, byte[] payload, Instant timestamp) {}
